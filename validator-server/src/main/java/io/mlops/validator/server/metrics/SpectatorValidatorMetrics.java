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

package io.mlops.validator.server.metrics;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import io.mlops.validator.api.model.JobKey;
import io.mlops.validator.api.model.JobPhase;
import io.mlops.validator.api.model.ReasonCode;
import io.mlops.validator.common.runtime.ValidatorRuntime;
import io.mlops.validator.server.retry.RetryClassification;

import static io.mlops.validator.server.metrics.MetricConstants.METRIC_RECONCILER;

@Singleton
public class SpectatorValidatorMetrics implements ValidatorMetrics {

    private static final String NONE = "none";

    private final Registry registry;

    private final Id reconcileId;
    private final Id phaseTransitionId;
    private final Id buildCreatedId;
    private final Id podCreatedId;
    private final Id retryId;

    private final Set<JobKey> activeJobs = ConcurrentHashMap.newKeySet();
    private final AtomicInteger activeJobsGauge;

    @Inject
    public SpectatorValidatorMetrics(ValidatorRuntime runtime) {
        this.registry = runtime.getRegistry();
        this.reconcileId = registry.createId(METRIC_RECONCILER + "reconcile");
        this.phaseTransitionId = registry.createId(METRIC_RECONCILER + "phaseTransitions");
        this.buildCreatedId = registry.createId(METRIC_RECONCILER + "buildsCreated");
        this.podCreatedId = registry.createId(METRIC_RECONCILER + "validationPodsCreated");
        this.retryId = registry.createId(METRIC_RECONCILER + "retries");
        this.activeJobsGauge = registry.gauge(METRIC_RECONCILER + "activeJobs", new AtomicInteger());
    }

    @Override
    public void reconcileCompleted(String result, long durationMs) {
        registry.timer(reconcileId.withTag("result", result)).record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void phaseTransition(JobPhase from, JobPhase to) {
        registry.counter(phaseTransitionId
                .withTag("from", from == null ? NONE : from.name())
                .withTag("to", to.name())
        ).increment();
    }

    @Override
    public void buildCreated(String strategy) {
        registry.counter(buildCreatedId.withTag("strategy", strategy)).increment();
    }

    @Override
    public void validationPodCreated() {
        registry.counter(podCreatedId).increment();
    }

    @Override
    public void retryClassified(RetryClassification classification, ReasonCode reasonCode) {
        registry.counter(retryId
                .withTag("classification", classification.name())
                .withTag("reason", reasonCode == null ? NONE : reasonCode.name())
        ).increment();
    }

    @Override
    public void jobState(JobKey key, boolean active) {
        if (active) {
            activeJobs.add(key);
        } else {
            activeJobs.remove(key);
        }
        activeJobsGauge.set(activeJobs.size());
    }
}
