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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.mlops.validator.api.model.BuildPhase;
import io.mlops.validator.api.model.BuildStatus;
import io.mlops.validator.api.model.Condition;
import io.mlops.validator.api.model.ConditionStatus;
import io.mlops.validator.api.model.ConditionType;
import io.mlops.validator.api.model.JobPhase;
import io.mlops.validator.api.model.ValidationJobSpec;
import io.mlops.validator.api.model.ValidationJobStatus;

/**
 * Derives the job conditions from its phase. Each condition type appears once, in {@link ConditionType} order.
 * The transition time of a condition changes only when its status changes.
 */
public class ConditionPropagator {

    static final String REASON_BUILD_NOT_REQUIRED = "BuildNotRequired";
    static final String REASON_BUILD_PENDING = "BuildPending";
    static final String REASON_BUILD_IN_PROGRESS = "BuildInProgress";
    static final String REASON_BUILD_SUCCEEDED = "BuildSucceeded";
    static final String REASON_VALIDATION_PENDING = "ValidationPending";
    static final String REASON_VALIDATION_RUNNING = "ValidationRunning";
    static final String REASON_VALIDATION_SUCCEEDED = "ValidationSucceeded";
    static final String REASON_IN_PROGRESS = "InProgress";
    static final String REASON_COMPLETED = "Completed";
    static final String REASON_FAILED = "Failed";

    public ValidationJobStatus propagate(ValidationJobSpec spec, ValidationJobStatus status, long now) {
        JobPhase phase = status.getPhase() == null ? JobPhase.Pending : status.getPhase();
        String failureReason = status.getReasonCode().map(Enum::name).orElse(REASON_FAILED);

        List<Condition> conditions = new ArrayList<>();
        conditions.add(buildReady(spec, status, phase, failureReason, now));
        conditions.add(validationReady(status, phase, failureReason, now));
        conditions.add(progressing(status, phase, now));
        conditions.add(available(status, phase, now));
        return status.toBuilder().withConditions(conditions).build();
    }

    private Condition buildReady(ValidationJobSpec spec, ValidationJobStatus status, JobPhase phase, String failureReason, long now) {
        if (!spec.isBuildEnabled()) {
            return next(status, ConditionType.BuildReady, ConditionStatus.True, REASON_BUILD_NOT_REQUIRED, "Image build is disabled", now);
        }
        Optional<BuildStatus> buildStatus = status.getBuildStatus();
        if (buildStatus.isPresent() && buildStatus.get().getPhase() == BuildPhase.Complete) {
            return next(status, ConditionType.BuildReady, ConditionStatus.True, REASON_BUILD_SUCCEEDED,
                    "Image " + buildStatus.get().getImageReference() + " built", now);
        }
        switch (phase) {
            case Pending:
            case Initializing:
                return next(status, ConditionType.BuildReady, ConditionStatus.Unknown, REASON_BUILD_PENDING, "Image build not started", now);
            case Failed:
                return next(status, ConditionType.BuildReady, ConditionStatus.False, failureReason, status.getMessage(), now);
            default:
                String message = buildStatus.map(BuildStatus::getMessage).filter(m -> !m.isEmpty()).orElse("Image build in progress");
                return next(status, ConditionType.BuildReady, ConditionStatus.False, REASON_BUILD_IN_PROGRESS, message, now);
        }
    }

    private Condition validationReady(ValidationJobStatus status, JobPhase phase, String failureReason, long now) {
        switch (phase) {
            case ValidationRunning:
                return next(status, ConditionType.ValidationReady, ConditionStatus.False, REASON_VALIDATION_RUNNING, status.getMessage(), now);
            case Succeeded:
                return next(status, ConditionType.ValidationReady, ConditionStatus.True, REASON_VALIDATION_SUCCEEDED, status.getMessage(), now);
            case Failed:
                return next(status, ConditionType.ValidationReady, ConditionStatus.False, failureReason, status.getMessage(), now);
            default:
                return next(status, ConditionType.ValidationReady, ConditionStatus.Unknown, REASON_VALIDATION_PENDING, "Validation not started", now);
        }
    }

    private Condition progressing(ValidationJobStatus status, JobPhase phase, long now) {
        if (phase == JobPhase.Succeeded) {
            return next(status, ConditionType.Progressing, ConditionStatus.False, REASON_COMPLETED, "Validation completed", now);
        }
        if (phase == JobPhase.Failed) {
            return next(status, ConditionType.Progressing, ConditionStatus.False, REASON_FAILED, "Validation failed", now);
        }
        return next(status, ConditionType.Progressing, ConditionStatus.True, REASON_IN_PROGRESS, "Job is in phase " + phase, now);
    }

    private Condition available(ValidationJobStatus status, JobPhase phase, long now) {
        if (phase == JobPhase.Succeeded) {
            return next(status, ConditionType.Available, ConditionStatus.True, REASON_COMPLETED, "Validation results are available", now);
        }
        return next(status, ConditionType.Available, ConditionStatus.False, phase == JobPhase.Failed ? REASON_FAILED : REASON_IN_PROGRESS,
                "Validation results are not available", now);
    }

    private static Condition next(ValidationJobStatus status, ConditionType type, ConditionStatus conditionStatus,
                                  String reason, String message, long now) {
        long transitionTime = status.findCondition(type)
                .filter(previous -> previous.getStatus() == conditionStatus)
                .map(Condition::getLastTransitionTime)
                .orElse(now);
        return new Condition(type, conditionStatus, reason, message, transitionTime);
    }
}
