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

package io.mlops.validator.api.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * Reconciler owned part of a validation job. A status with no phase belongs to a job that was never reconciled.
 */
public class ValidationJobStatus {

    private static final ValidationJobStatus EMPTY = newBuilder().build();

    private final JobPhase phase;
    private final BuildStatus buildStatus;
    private final List<Condition> conditions;
    private final List<CellResult> results;
    private final int retryCount;
    private final long lastRetryTime;
    private final long startTime;
    private final long completionTime;
    private final String message;
    private final ReasonCode reasonCode;
    private final String validationPodName;
    private final long observedGeneration;
    private final String specHash;
    private final ModelValidationResult modelValidationResult;

    public ValidationJobStatus(JobPhase phase,
                               BuildStatus buildStatus,
                               List<Condition> conditions,
                               List<CellResult> results,
                               int retryCount,
                               long lastRetryTime,
                               long startTime,
                               long completionTime,
                               String message,
                               ReasonCode reasonCode,
                               String validationPodName,
                               long observedGeneration,
                               String specHash,
                               ModelValidationResult modelValidationResult) {
        this.phase = phase;
        this.buildStatus = buildStatus;
        this.conditions = conditions == null ? Collections.emptyList() : ImmutableList.copyOf(conditions);
        this.results = results == null ? Collections.emptyList() : ImmutableList.copyOf(results);
        this.retryCount = retryCount;
        this.lastRetryTime = lastRetryTime;
        this.startTime = startTime;
        this.completionTime = completionTime;
        this.message = message == null ? "" : message;
        this.reasonCode = reasonCode;
        this.validationPodName = validationPodName == null ? "" : validationPodName;
        this.observedGeneration = observedGeneration;
        this.specHash = specHash == null ? "" : specHash;
        this.modelValidationResult = modelValidationResult;
    }

    public static ValidationJobStatus empty() {
        return EMPTY;
    }

    /**
     * Current phase, or null if the job has not been reconciled yet.
     */
    public JobPhase getPhase() {
        return phase;
    }

    public Optional<BuildStatus> getBuildStatus() {
        return Optional.ofNullable(buildStatus);
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public Optional<Condition> findCondition(ConditionType type) {
        return conditions.stream().filter(c -> c.getType() == type).findFirst();
    }

    public List<CellResult> getResults() {
        return results;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public long getLastRetryTime() {
        return lastRetryTime;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getCompletionTime() {
        return completionTime;
    }

    public String getMessage() {
        return message;
    }

    public Optional<ReasonCode> getReasonCode() {
        return Optional.ofNullable(reasonCode);
    }

    public String getValidationPodName() {
        return validationPodName;
    }

    public long getObservedGeneration() {
        return observedGeneration;
    }

    public String getSpecHash() {
        return specHash;
    }

    public Optional<ModelValidationResult> getModelValidationResult() {
        return Optional.ofNullable(modelValidationResult);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ValidationJobStatus that = (ValidationJobStatus) o;
        return retryCount == that.retryCount &&
                lastRetryTime == that.lastRetryTime &&
                startTime == that.startTime &&
                completionTime == that.completionTime &&
                observedGeneration == that.observedGeneration &&
                phase == that.phase &&
                Objects.equals(buildStatus, that.buildStatus) &&
                Objects.equals(conditions, that.conditions) &&
                Objects.equals(results, that.results) &&
                Objects.equals(message, that.message) &&
                reasonCode == that.reasonCode &&
                Objects.equals(validationPodName, that.validationPodName) &&
                Objects.equals(specHash, that.specHash) &&
                Objects.equals(modelValidationResult, that.modelValidationResult);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phase, buildStatus, conditions, results, retryCount, lastRetryTime, startTime,
                completionTime, message, reasonCode, validationPodName, observedGeneration, specHash, modelValidationResult);
    }

    @Override
    public String toString() {
        return "ValidationJobStatus{" +
                "phase=" + phase +
                ", buildStatus=" + buildStatus +
                ", conditions=" + conditions +
                ", results=" + results.size() +
                ", retryCount=" + retryCount +
                ", lastRetryTime=" + lastRetryTime +
                ", startTime=" + startTime +
                ", completionTime=" + completionTime +
                ", message='" + message + '\'' +
                ", reasonCode=" + reasonCode +
                ", validationPodName='" + validationPodName + '\'' +
                ", observedGeneration=" + observedGeneration +
                ", specHash='" + specHash + '\'' +
                ", modelValidationResult=" + modelValidationResult +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withPhase(phase)
                .withBuildStatus(buildStatus)
                .withConditions(conditions)
                .withResults(results)
                .withRetryCount(retryCount)
                .withLastRetryTime(lastRetryTime)
                .withStartTime(startTime)
                .withCompletionTime(completionTime)
                .withMessage(message)
                .withReasonCode(reasonCode)
                .withValidationPodName(validationPodName)
                .withObservedGeneration(observedGeneration)
                .withSpecHash(specHash)
                .withModelValidationResult(modelValidationResult);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private JobPhase phase;
        private BuildStatus buildStatus;
        private List<Condition> conditions;
        private List<CellResult> results;
        private int retryCount;
        private long lastRetryTime;
        private long startTime;
        private long completionTime;
        private String message;
        private ReasonCode reasonCode;
        private String validationPodName;
        private long observedGeneration;
        private String specHash;
        private ModelValidationResult modelValidationResult;

        private Builder() {
        }

        public Builder withPhase(JobPhase phase) {
            this.phase = phase;
            return this;
        }

        public Builder withBuildStatus(BuildStatus buildStatus) {
            this.buildStatus = buildStatus;
            return this;
        }

        public Builder withConditions(List<Condition> conditions) {
            this.conditions = conditions;
            return this;
        }

        public Builder withResults(List<CellResult> results) {
            this.results = results;
            return this;
        }

        public Builder withRetryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder withLastRetryTime(long lastRetryTime) {
            this.lastRetryTime = lastRetryTime;
            return this;
        }

        public Builder withStartTime(long startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder withCompletionTime(long completionTime) {
            this.completionTime = completionTime;
            return this;
        }

        public Builder withMessage(String message) {
            this.message = message;
            return this;
        }

        public Builder withReasonCode(ReasonCode reasonCode) {
            this.reasonCode = reasonCode;
            return this;
        }

        public Builder withValidationPodName(String validationPodName) {
            this.validationPodName = validationPodName;
            return this;
        }

        public Builder withObservedGeneration(long observedGeneration) {
            this.observedGeneration = observedGeneration;
            return this;
        }

        public Builder withSpecHash(String specHash) {
            this.specHash = specHash;
            return this;
        }

        public Builder withModelValidationResult(ModelValidationResult modelValidationResult) {
            this.modelValidationResult = modelValidationResult;
            return this;
        }

        public ValidationJobStatus build() {
            return new ValidationJobStatus(phase, buildStatus, conditions, results, retryCount, lastRetryTime,
                    startTime, completionTime, message, reasonCode, validationPodName, observedGeneration, specHash, modelValidationResult);
        }
    }
}
