/*
 * Copyright 2025 The Notebook Validator Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.mlops.validator.server.controller;

import java.time.Duration;
import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.mlops.validator.common.util.Evaluators;
import io.mlops.validator.server.kubernetes.ClusterApiFacade;
import io.mlops.validator.server.kubernetes.ValidationJobEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.util.retry.Retry;

/**
 * Feeds job and pod change events into the work queue. The event stream is re-subscribed with a backoff if the
 * watch connection fails.
 */
@Singleton
public class ValidationJobController {

    private static final Logger logger = LoggerFactory.getLogger(ValidationJobController.class);

    private static final Duration RETRY_MIN_BACKOFF = Duration.ofSeconds(1);
    private static final Duration RETRY_MAX_BACKOFF = Duration.ofMinutes(1);

    private final ClusterApiFacade clusterApi;
    private final JobWorkQueue workQueue;
    private final ValidatorControllerConfiguration configuration;

    private Disposable eventSubscription;

    @Inject
    public ValidationJobController(ClusterApiFacade clusterApi,
                                   JobWorkQueue workQueue,
                                   ValidatorControllerConfiguration configuration) {
        this.clusterApi = clusterApi;
        this.workQueue = workQueue;
        this.configuration = configuration;
    }

    @PostConstruct
    public void activate() {
        if (!configuration.isEnabled()) {
            logger.info("Validation job controller disabled");
            return;
        }
        this.eventSubscription = clusterApi.events(Duration.ofMillis(configuration.getResyncIntervalMs()))
                .retryWhen(Retry.backoff(Long.MAX_VALUE, RETRY_MIN_BACKOFF)
                        .maxBackoff(RETRY_MAX_BACKOFF)
                        .doBeforeRetry(signal -> logger.warn("Job event stream failed (retry {}), re-subscribing: {}",
                                signal.totalRetries() + 1, signal.failure().getMessage()))
                )
                .subscribe(
                        this::onEvent,
                        e -> logger.error("Job event stream terminated with an error", e),
                        () -> logger.info("Job event stream completed")
                );
        logger.info("Validation job controller started: workers={}, resyncInterval={}ms",
                configuration.getWorkerCount(), configuration.getResyncIntervalMs());
    }

    @PreDestroy
    public void shutdown() {
        Evaluators.acceptNotNull(eventSubscription, Disposable::dispose);
        workQueue.shutdown();
        logger.info("Validation job controller stopped");
    }

    void onEvent(ValidationJobEvent event) {
        switch (event.getType()) {
            case Deleted:
                // The job object is gone. Stop any running reconcile, and let one more pass remove leftovers.
                workQueue.cancel(event.getKey());
                workQueue.enqueue(event.getKey());
                break;
            case Updated:
            default:
                workQueue.enqueue(event.getKey());
        }
    }
}
