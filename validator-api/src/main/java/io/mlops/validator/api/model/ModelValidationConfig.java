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

import com.google.common.collect.ImmutableList;

/**
 * Optional model serving check of a validation job. The controller only verifies that the requested serving platform
 * is installed and passes the settings to the notebook, which talks to the models itself.
 */
public class ModelValidationConfig {

    public static final String DEFAULT_PLATFORM = "kserve";
    public static final String DEFAULT_PHASE = "both";
    public static final String DEFAULT_TIMEOUT = "5m";

    private static final ModelValidationConfig DISABLED = newBuilder().build();

    private final boolean enabled;
    private final String platform;
    private final String phase;
    private final List<String> targetModels;
    private final String timeout;

    public ModelValidationConfig(boolean enabled, String platform, String phase, List<String> targetModels, String timeout) {
        this.enabled = enabled;
        this.platform = platform == null || platform.isEmpty() ? DEFAULT_PLATFORM : platform;
        this.phase = phase == null || phase.isEmpty() ? DEFAULT_PHASE : phase;
        this.targetModels = targetModels == null ? Collections.emptyList() : ImmutableList.copyOf(targetModels);
        this.timeout = timeout == null || timeout.isEmpty() ? DEFAULT_TIMEOUT : timeout;
    }

    public static ModelValidationConfig disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Serving platform name, for example 'kserve' or 'ray'.
     */
    public String getPlatform() {
        return platform;
    }

    /**
     * One of 'clean', 'existing' or 'both'.
     */
    public String getPhase() {
        return phase;
    }

    /**
     * Model names, optionally prefixed with their namespace ('namespace/model').
     */
    public List<String> getTargetModels() {
        return targetModels;
    }

    public String getTimeout() {
        return timeout;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ModelValidationConfig that = (ModelValidationConfig) o;
        return enabled == that.enabled &&
                Objects.equals(platform, that.platform) &&
                Objects.equals(phase, that.phase) &&
                Objects.equals(targetModels, that.targetModels) &&
                Objects.equals(timeout, that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, platform, phase, targetModels, timeout);
    }

    @Override
    public String toString() {
        return "ModelValidationConfig{" +
                "enabled=" + enabled +
                ", platform='" + platform + '\'' +
                ", phase='" + phase + '\'' +
                ", targetModels=" + targetModels +
                ", timeout='" + timeout + '\'' +
                '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean enabled;
        private String platform;
        private String phase;
        private List<String> targetModels;
        private String timeout;

        private Builder() {
        }

        public Builder withEnabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder withPlatform(String platform) {
            this.platform = platform;
            return this;
        }

        public Builder withPhase(String phase) {
            this.phase = phase;
            return this;
        }

        public Builder withTargetModels(List<String> targetModels) {
            this.targetModels = targetModels;
            return this;
        }

        public Builder withTimeout(String timeout) {
            this.timeout = timeout;
            return this;
        }

        public ModelValidationConfig build() {
            return new ModelValidationConfig(enabled, platform, phase, targetModels, timeout);
        }
    }
}
