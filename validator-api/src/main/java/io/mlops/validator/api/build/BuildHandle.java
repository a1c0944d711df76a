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

package io.mlops.validator.api.build;

import java.util.Objects;
import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * Identity of one build attempt of a job. A handle is derived from the job identity and the attempt number only,
 * so it can always be reconstructed after a controller restart.
 */
public final class BuildHandle {

    private final String namespace;
    private final String jobName;
    private final String jobId;
    private final int attempt;

    private BuildHandle(String namespace, String jobName, String jobId, int attempt) {
        this.namespace = Preconditions.checkNotNull(namespace, "namespace is null");
        this.jobName = Preconditions.checkNotNull(jobName, "job name is null");
        this.jobId = Preconditions.checkNotNull(jobId, "job id is null");
        Preconditions.checkArgument(attempt > 0, "attempt must be > 0: %s", attempt);
        this.attempt = attempt;
    }

    public static BuildHandle of(String namespace, String jobName, String jobId, int attempt) {
        return new BuildHandle(namespace, jobName, jobId, attempt);
    }

    /**
     * Reconstructs the handle of a build run from its name, as recorded in the job status.
     */
    public static Optional<BuildHandle> fromBuildName(String namespace, String jobName, String jobId, String buildName) {
        String prefix = jobName + "-build-";
        if (buildName == null || !buildName.startsWith(prefix)) {
            return Optional.empty();
        }
        try {
            int attempt = Integer.parseInt(buildName.substring(prefix.length()));
            return attempt > 0 ? Optional.of(new BuildHandle(namespace, jobName, jobId, attempt)) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public String getNamespace() {
        return namespace;
    }

    public String getJobName() {
        return jobName;
    }

    public String getJobId() {
        return jobId;
    }

    public int getAttempt() {
        return attempt;
    }

    /**
     * Name shared by build resources that live for the whole job (build configuration, pipeline, image stream).
     */
    public String getBuildBaseName() {
        return jobName + "-build";
    }

    /**
     * Name of the build run of this attempt.
     */
    public String getBuildName() {
        return jobName + "-build-" + attempt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BuildHandle that = (BuildHandle) o;
        return attempt == that.attempt &&
                Objects.equals(namespace, that.namespace) &&
                Objects.equals(jobName, that.jobName) &&
                Objects.equals(jobId, that.jobId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, jobName, jobId, attempt);
    }

    @Override
    public String toString() {
        return "BuildHandle{" +
                "namespace='" + namespace + '\'' +
                ", jobName='" + jobName + '\'' +
                ", jobId='" + jobId + '\'' +
                ", attempt=" + attempt +
                '}';
    }
}
