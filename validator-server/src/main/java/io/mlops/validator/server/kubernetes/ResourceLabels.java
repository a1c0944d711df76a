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

package io.mlops.validator.server.kubernetes;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.mlops.validator.api.build.BuildHandle;
import io.mlops.validator.api.model.ValidationJob;

/**
 * Labels attached to every resource created on behalf of a validation job. Child resources are only ever found
 * through these labels.
 */
public final class ResourceLabels {

    public static final String LABEL_JOB_ID = "validation.mlops.dev/job-id";
    public static final String LABEL_COMPONENT = "validation.mlops.dev/component";
    public static final String LABEL_OWNER = "validation.mlops.dev/owner";
    public static final String LABEL_ATTEMPT = "validation.mlops.dev/attempt";

    public static final String COMPONENT_BUILD = "build";
    public static final String COMPONENT_VALIDATION = "validation";

    public static final String CLEANUP_FINALIZER = "mlops.mlops.dev/finalizer";

    private ResourceLabels() {
    }

    public static Map<String, String> forBuild(BuildHandle handle) {
        return ImmutableMap.of(
                LABEL_JOB_ID, handle.getJobId(),
                LABEL_COMPONENT, COMPONENT_BUILD,
                LABEL_OWNER, handle.getJobName(),
                LABEL_ATTEMPT, Integer.toString(handle.getAttempt())
        );
    }

    public static Map<String, String> forValidationPod(ValidationJob job, int attempt) {
        return ImmutableMap.of(
                LABEL_JOB_ID, job.getUid(),
                LABEL_COMPONENT, COMPONENT_VALIDATION,
                LABEL_OWNER, job.getName(),
                LABEL_ATTEMPT, Integer.toString(attempt)
        );
    }

    /**
     * Selects all build resources of a job, whatever the attempt.
     */
    public static Map<String, String> buildSelector(String jobId) {
        return ImmutableMap.of(LABEL_JOB_ID, jobId, LABEL_COMPONENT, COMPONENT_BUILD);
    }

    /**
     * Selects the build run of one attempt.
     */
    public static Map<String, String> buildAttemptSelector(BuildHandle handle) {
        return ImmutableMap.of(
                LABEL_JOB_ID, handle.getJobId(),
                LABEL_COMPONENT, COMPONENT_BUILD,
                LABEL_ATTEMPT, Integer.toString(handle.getAttempt())
        );
    }

    public static Map<String, String> validationSelector(String jobId) {
        return ImmutableMap.of(LABEL_JOB_ID, jobId, LABEL_COMPONENT, COMPONENT_VALIDATION);
    }

    public static Map<String, String> jobSelector(String jobId) {
        return ImmutableMap.of(LABEL_JOB_ID, jobId);
    }

    /**
     * Controller reference to the owning job, so that the cluster garbage collects the child when the job is gone
     * even if the cleanup finalizer was bypassed. Empty for a job without uid, which the API server would reject.
     */
    public static List<OwnerReference> ownerReferences(String jobName, String jobUid) {
        if (jobUid == null || jobUid.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.singletonList(new OwnerReferenceBuilder()
                .withApiVersion(ResourceKind.VALIDATION_JOB.getApiVersion())
                .withKind(ResourceKind.VALIDATION_JOB.getKind())
                .withName(jobName)
                .withUid(jobUid)
                .withController(true)
                .withBlockOwnerDeletion(true)
                .build()
        );
    }

    /**
     * Selects resources by the owning job name. Used when the job object is gone, and its uid is not known anymore.
     */
    public static Map<String, String> ownerSelector(String jobName) {
        return ImmutableMap.of(LABEL_OWNER, jobName);
    }
}
