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

import io.mlops.validator.api.model.BuildPhase;

/**
 * Observed state of a build run, as reported by a strategy.
 */
public class BuildInfo {

    private final String name;
    private final BuildPhase phase;
    private final String message;
    private final String imageReference;
    private final long startTime;
    private final long completionTime;

    public BuildInfo(String name, BuildPhase phase, String message, String imageReference, long startTime, long completionTime) {
        this.name = name;
        this.phase = phase;
        this.message = message == null ? "" : message;
        this.imageReference = imageReference;
        this.startTime = startTime;
        this.completionTime = completionTime;
    }

    public String getName() {
        return name;
    }

    public BuildPhase getPhase() {
        return phase;
    }

    public String getMessage() {
        return message;
    }

    public Optional<String> getImageReference() {
        return imageReference == null || imageReference.isEmpty() ? Optional.empty() : Optional.of(imageReference);
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
        BuildInfo buildInfo = (BuildInfo) o;
        return startTime == buildInfo.startTime &&
                completionTime == buildInfo.completionTime &&
                Objects.equals(name, buildInfo.name) &&
                phase == buildInfo.phase &&
                Objects.equals(message, buildInfo.message) &&
                Objects.equals(imageReference, buildInfo.imageReference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, phase, message, imageReference, startTime, completionTime);
    }

    @Override
    public String toString() {
        return "BuildInfo{" +
                "name='" + name + '\'' +
                ", phase=" + phase +
                ", message='" + message + '\'' +
                ", imageReference='" + imageReference + '\'' +
                ", startTime=" + startTime +
                ", completionTime=" + completionTime +
                '}';
    }
}
