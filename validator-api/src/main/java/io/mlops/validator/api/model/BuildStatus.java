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

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * State of the image build of a job. The image reference is present if and only if the build is complete.
 */
public class BuildStatus {

    private final BuildPhase phase;
    private final String strategy;
    private final String imageReference;
    private final String message;
    private final String buildName;
    private final long startTime;
    private final long completionTime;

    public BuildStatus(BuildPhase phase,
                       String strategy,
                       String imageReference,
                       String message,
                       String buildName,
                       long startTime,
                       long completionTime) {
        this.phase = Preconditions.checkNotNull(phase, "build phase is null");
        this.strategy = strategy == null ? "" : strategy;
        this.imageReference = imageReference == null ? "" : imageReference;
        this.message = message == null ? "" : message;
        this.buildName = buildName == null ? "" : buildName;
        this.startTime = startTime;
        this.completionTime = completionTime;

        Preconditions.checkArgument(
                (phase == BuildPhase.Complete) == !this.imageReference.isEmpty(),
                "Image reference must be set if and only if the build is complete: phase=%s, imageReference=%s",
                phase, this.imageReference
        );
    }

    public BuildPhase getPhase() {
        return phase;
    }

    /**
     * Name of the strategy selected for the job. Only the name is kept, the strategy itself is looked up again
     * in the registry on each reconcile.
     */
    public String getStrategy() {
        return strategy;
    }

    public String getImageReference() {
        return imageReference;
    }

    public String getMessage() {
        return message;
    }

    public String getBuildName() {
        return buildName;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getCompletionTime() {
        return completionTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BuildStatus that = (BuildStatus) o;
        return startTime == that.startTime &&
                completionTime == that.completionTime &&
                phase == that.phase &&
                Objects.equals(strategy, that.strategy) &&
                Objects.equals(imageReference, that.imageReference) &&
                Objects.equals(message, that.message) &&
                Objects.equals(buildName, that.buildName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phase, strategy, imageReference, message, buildName, startTime, completionTime);
    }

    @Override
    public String toString() {
        return "BuildStatus{" +
                "phase=" + phase +
                ", strategy='" + strategy + '\'' +
                ", imageReference='" + imageReference + '\'' +
                ", message='" + message + '\'' +
                ", buildName='" + buildName + '\'' +
                ", startTime=" + startTime +
                ", completionTime=" + completionTime +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withPhase(phase)
                .withStrategy(strategy)
                .withImageReference(imageReference)
                .withMessage(message)
                .withBuildName(buildName)
                .withStartTime(startTime)
                .withCompletionTime(completionTime);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private BuildPhase phase = BuildPhase.Pending;
        private String strategy;
        private String imageReference;
        private String message;
        private String buildName;
        private long startTime;
        private long completionTime;

        private Builder() {
        }

        public Builder withPhase(BuildPhase phase) {
            this.phase = phase;
            return this;
        }

        public Builder withStrategy(String strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder withImageReference(String imageReference) {
            this.imageReference = imageReference;
            return this;
        }

        public Builder withMessage(String message) {
            this.message = message;
            return this;
        }

        public Builder withBuildName(String buildName) {
            this.buildName = buildName;
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

        public BuildStatus build() {
            return new BuildStatus(phase, strategy, imageReference, message, buildName, startTime, completionTime);
        }
    }
}
