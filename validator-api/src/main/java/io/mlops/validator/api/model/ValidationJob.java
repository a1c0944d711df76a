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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Immutable snapshot of a notebook validation job custom resource. Each status change produces a new
 * {@link ValidationJob} instance, which is then written back to the cluster.
 */
public class ValidationJob {

    private final JobKey key;
    private final String uid;
    private final long generation;
    private final String resourceVersion;
    private final boolean deletionRequested;
    private final List<String> finalizers;
    private final ValidationJobSpec spec;
    private final ValidationJobStatus status;
    private final String specError;

    public ValidationJob(JobKey key,
                         String uid,
                         long generation,
                         String resourceVersion,
                         boolean deletionRequested,
                         List<String> finalizers,
                         ValidationJobSpec spec,
                         ValidationJobStatus status,
                         String specError) {
        this.key = Preconditions.checkNotNull(key, "job key is null");
        this.uid = uid == null ? "" : uid;
        this.generation = generation;
        this.resourceVersion = resourceVersion;
        this.deletionRequested = deletionRequested;
        this.finalizers = finalizers == null ? Collections.emptyList() : ImmutableList.copyOf(finalizers);
        this.spec = Preconditions.checkNotNull(spec, "job spec is null");
        this.status = status == null ? ValidationJobStatus.empty() : status;
        this.specError = specError == null ? "" : specError;
    }

    public JobKey getKey() {
        return key;
    }

    public String getNamespace() {
        return key.getNamespace();
    }

    public String getName() {
        return key.getName();
    }

    /**
     * Cluster assigned unique identifier, fixed for the job lifetime.
     */
    public String getUid() {
        return uid;
    }

    /**
     * Spec generation, incremented by the cluster on each spec change.
     */
    public long getGeneration() {
        return generation;
    }

    public String getResourceVersion() {
        return resourceVersion;
    }

    /**
     * True if the user deleted the job, and the cluster waits for the cleanup finalizer to be removed.
     */
    public boolean isDeletionRequested() {
        return deletionRequested;
    }

    public List<String> getFinalizers() {
        return finalizers;
    }

    public ValidationJobSpec getSpec() {
        return spec;
    }

    public ValidationJobStatus getStatus() {
        return status;
    }

    /**
     * Set when the stored spec could not be read into the model. The {@link #getSpec() spec} is then a
     * placeholder and must not be acted upon.
     */
    public Optional<String> getSpecError() {
        return specError.isEmpty() ? Optional.empty() : Optional.of(specError);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ValidationJob that = (ValidationJob) o;
        return generation == that.generation &&
                deletionRequested == that.deletionRequested &&
                Objects.equals(key, that.key) &&
                Objects.equals(uid, that.uid) &&
                Objects.equals(resourceVersion, that.resourceVersion) &&
                Objects.equals(finalizers, that.finalizers) &&
                Objects.equals(spec, that.spec) &&
                Objects.equals(status, that.status) &&
                Objects.equals(specError, that.specError);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, uid, generation, resourceVersion, deletionRequested, finalizers, spec, status, specError);
    }

    @Override
    public String toString() {
        return "ValidationJob{" +
                "key=" + key +
                ", uid='" + uid + '\'' +
                ", generation=" + generation +
                ", resourceVersion='" + resourceVersion + '\'' +
                ", deletionRequested=" + deletionRequested +
                ", finalizers=" + finalizers +
                ", spec=" + spec +
                ", status=" + status +
                ", specError='" + specError + '\'' +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withKey(key)
                .withUid(uid)
                .withGeneration(generation)
                .withResourceVersion(resourceVersion)
                .withDeletionRequested(deletionRequested)
                .withFinalizers(finalizers)
                .withSpec(spec)
                .withStatus(status)
                .withSpecError(specError);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private JobKey key;
        private String uid;
        private long generation;
        private String resourceVersion;
        private boolean deletionRequested;
        private List<String> finalizers;
        private ValidationJobSpec spec;
        private ValidationJobStatus status;
        private String specError;

        private Builder() {
        }

        public Builder withKey(JobKey key) {
            this.key = key;
            return this;
        }

        public Builder withUid(String uid) {
            this.uid = uid;
            return this;
        }

        public Builder withGeneration(long generation) {
            this.generation = generation;
            return this;
        }

        public Builder withResourceVersion(String resourceVersion) {
            this.resourceVersion = resourceVersion;
            return this;
        }

        public Builder withDeletionRequested(boolean deletionRequested) {
            this.deletionRequested = deletionRequested;
            return this;
        }

        public Builder withFinalizers(List<String> finalizers) {
            this.finalizers = finalizers;
            return this;
        }

        public Builder withSpec(ValidationJobSpec spec) {
            this.spec = spec;
            return this;
        }

        public Builder withStatus(ValidationJobStatus status) {
            this.status = status;
            return this;
        }

        public Builder withSpecError(String specError) {
            this.specError = specError;
            return this;
        }

        public ValidationJob build() {
            return new ValidationJob(key, uid, generation, resourceVersion, deletionRequested, finalizers, spec, status, specError);
        }
    }
}
