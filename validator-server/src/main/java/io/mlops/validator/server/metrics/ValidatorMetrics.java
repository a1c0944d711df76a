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

import io.mlops.validator.api.model.JobKey;
import io.mlops.validator.api.model.JobPhase;
import io.mlops.validator.api.model.ReasonCode;
import io.mlops.validator.server.retry.RetryClassification;

/**
 * Metrics sink of the reconciliation engine.
 */
public interface ValidatorMetrics {

    ValidatorMetrics NO_OP = new ValidatorMetrics() {
        @Override
        public void reconcileCompleted(String result, long durationMs) {
        }

        @Override
        public void phaseTransition(JobPhase from, JobPhase to) {
        }

        @Override
        public void buildCreated(String strategy) {
        }

        @Override
        public void validationPodCreated() {
        }

        @Override
        public void retryClassified(RetryClassification classification, ReasonCode reasonCode) {
        }

        @Override
        public void jobState(JobKey key, boolean active) {
        }
    };

    void reconcileCompleted(String result, long durationMs);

    /**
     * @param from previous phase, or null for a new job
     */
    void phaseTransition(JobPhase from, JobPhase to);

    void buildCreated(String strategy);

    void validationPodCreated();

    void retryClassified(RetryClassification classification, ReasonCode reasonCode);

    /**
     * Records whether the job is still in progress. Feeds the active jobs gauge.
     */
    void jobState(JobKey key, boolean active);

    static ValidatorMetrics noOp() {
        return NO_OP;
    }
}
