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

package io.mlops.validator.server.status;

import java.util.Objects;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.mlops.validator.api.model.JobPhase;
import io.mlops.validator.api.model.ValidationJob;
import io.mlops.validator.api.model.ValidationJobStatus;
import io.mlops.validator.api.service.ValidatorException;
import io.mlops.validator.common.runtime.ValidatorRuntime;
import io.mlops.validator.server.kubernetes.ClusterApiFacade;
import io.mlops.validator.server.kubernetes.KubeApiException;
import io.mlops.validator.server.metrics.ValidatorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes job status changes through the status subresource. Conditions are recomputed before each write, and a
 * status equal to the stored one is not written at all.
 */
@Singleton
public class StatusUpdater {

    private static final Logger logger = LoggerFactory.getLogger(StatusUpdater.class);

    static final int MAX_CONFLICT_RETRIES = 5;
    static final long INITIAL_CONFLICT_DELAY_MS = 100;

    private final ClusterApiFacade clusterApi;
    private final ValidatorRuntime runtime;
    private final ValidatorMetrics metrics;
    private final ConditionPropagator conditionPropagator = new ConditionPropagator();

    @Inject
    public StatusUpdater(ClusterApiFacade clusterApi, ValidatorRuntime runtime, ValidatorMetrics metrics) {
        this.clusterApi = clusterApi;
        this.runtime = runtime;
        this.metrics = metrics;
    }

    /**
     * Writes the new status, if it differs from the current one. Returns the job as stored after the write.
     */
    public ValidationJob update(ValidationJob current, ValidationJobStatus newStatus) {
        ValidationJobStatus effective = conditionPropagator.propagate(current.getSpec(), newStatus, runtime.getClock().wallTime());
        if (effective.equals(current.getStatus())) {
            logger.debug("Status of job {} unchanged, skipping the update", current.getKey());
            return current;
        }

        ValidationJob updated = write(current.toBuilder().withStatus(effective).build());

        JobPhase from = current.getStatus().getPhase();
        JobPhase to = effective.getPhase();
        if (!Objects.equals(from, to)) {
            if (from != null && to != null && to != JobPhase.Pending && !from.canTransitionTo(to)) {
                logger.warn("Job {} made an unexpected phase transition {} -> {}", current.getKey(), from, to);
            }
            logger.info("Job {} moved from phase {} to {}: {}", current.getKey(), from, to, effective.getMessage());
            metrics.phaseTransition(from, to);
        }
        metrics.jobState(current.getKey(), to == null || !to.isTerminal());
        return updated;
    }

    private ValidationJob write(ValidationJob job) {
        long delayMs = INITIAL_CONFLICT_DELAY_MS;
        KubeApiException lastConflict = null;
        for (int attempt = 0; attempt < MAX_CONFLICT_RETRIES; attempt++) {
            try {
                return clusterApi.updateValidationJobStatus(job);
            } catch (KubeApiException e) {
                if (e.getErrorCode() != KubeApiException.ErrorCode.CONFLICT) {
                    throw e;
                }
                lastConflict = e;
                logger.debug("Status update conflict for job {} (attempt {}), retrying in {}ms", job.getKey(), attempt + 1, delayMs);
                sleep(delayMs);
                delayMs *= 2;
                Optional<ValidationJob> latest = clusterApi.findValidationJob(job.getKey());
                if (!latest.isPresent()) {
                    logger.info("Job {} deleted while updating its status", job.getKey());
                    return job;
                }
                job = latest.get().toBuilder().withStatus(job.getStatus()).build();
            }
        }
        throw ValidatorException.transientInfra(
                String.format("Status update of job %s conflicted %d times", job.getKey(), MAX_CONFLICT_RETRIES), lastConflict
        );
    }

    private static void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ValidatorException.transientInfra("Interrupted while retrying a status update", e);
        }
    }
}
