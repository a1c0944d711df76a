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
import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableMap;

/**
 * Image build part of the job spec. When the build is disabled, the pod configuration image is used as is.
 */
public class BuildConfig {

    public static final String AUTO_STRATEGY = "auto";

    public static final String DEFAULT_REQUIREMENTS_FILE = "requirements.txt";

    private static final BuildConfig DISABLED = newBuilder().withEnabled(false).build();

    private final boolean enabled;
    private final String strategy;
    private final String baseImage;
    private final String dockerfile;
    private final FallbackPolicy fallbackPolicy;
    private final String requirementsFile;
    private final Map<String, String> strategyConfig;
    private final String timeout;

    public BuildConfig(boolean enabled,
                       String strategy,
                       String baseImage,
                       String dockerfile,
                       FallbackPolicy fallbackPolicy,
                       String requirementsFile,
                       Map<String, String> strategyConfig,
                       String timeout) {
        this.enabled = enabled;
        this.strategy = strategy == null || strategy.isEmpty() ? AUTO_STRATEGY : strategy;
        this.baseImage = baseImage;
        this.dockerfile = dockerfile;
        this.fallbackPolicy = fallbackPolicy == null ? FallbackPolicy.Auto : fallbackPolicy;
        this.requirementsFile = requirementsFile == null || requirementsFile.isEmpty() ? DEFAULT_REQUIREMENTS_FILE : requirementsFile;
        this.strategyConfig = strategyConfig == null ? Collections.emptyMap() : ImmutableMap.copyOf(strategyConfig);
        this.timeout = timeout;
    }

    public static BuildConfig disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Strategy name, or {@link #AUTO_STRATEGY}.
     */
    public String getStrategy() {
        return strategy;
    }

    public boolean isAutoStrategy() {
        return AUTO_STRATEGY.equalsIgnoreCase(strategy);
    }

    public String getBaseImage() {
        return baseImage;
    }

    /**
     * Custom Dockerfile path relative to the repository root, or null if the build file should be generated.
     */
    public String getDockerfile() {
        return dockerfile;
    }

    public FallbackPolicy getFallbackPolicy() {
        return fallbackPolicy;
    }

    public String getRequirementsFile() {
        return requirementsFile;
    }

    public Map<String, String> getStrategyConfig() {
        return strategyConfig;
    }

    /**
     * Build timeout duration string (for example "15m"), or null for the configured default.
     */
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
        BuildConfig that = (BuildConfig) o;
        return enabled == that.enabled &&
                Objects.equals(strategy, that.strategy) &&
                Objects.equals(baseImage, that.baseImage) &&
                Objects.equals(dockerfile, that.dockerfile) &&
                fallbackPolicy == that.fallbackPolicy &&
                Objects.equals(requirementsFile, that.requirementsFile) &&
                Objects.equals(strategyConfig, that.strategyConfig) &&
                Objects.equals(timeout, that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, strategy, baseImage, dockerfile, fallbackPolicy, requirementsFile, strategyConfig, timeout);
    }

    @Override
    public String toString() {
        return "BuildConfig{" +
                "enabled=" + enabled +
                ", strategy='" + strategy + '\'' +
                ", baseImage='" + baseImage + '\'' +
                ", dockerfile='" + dockerfile + '\'' +
                ", fallbackPolicy=" + fallbackPolicy +
                ", requirementsFile='" + requirementsFile + '\'' +
                ", strategyConfig=" + strategyConfig +
                ", timeout='" + timeout + '\'' +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withEnabled(enabled)
                .withStrategy(strategy)
                .withBaseImage(baseImage)
                .withDockerfile(dockerfile)
                .withFallbackPolicy(fallbackPolicy)
                .withRequirementsFile(requirementsFile)
                .withStrategyConfig(strategyConfig)
                .withTimeout(timeout);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean enabled;
        private String strategy;
        private String baseImage;
        private String dockerfile;
        private FallbackPolicy fallbackPolicy;
        private String requirementsFile;
        private Map<String, String> strategyConfig;
        private String timeout;

        private Builder() {
        }

        public Builder withEnabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder withStrategy(String strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder withBaseImage(String baseImage) {
            this.baseImage = baseImage;
            return this;
        }

        public Builder withDockerfile(String dockerfile) {
            this.dockerfile = dockerfile;
            return this;
        }

        public Builder withFallbackPolicy(FallbackPolicy fallbackPolicy) {
            this.fallbackPolicy = fallbackPolicy;
            return this;
        }

        public Builder withRequirementsFile(String requirementsFile) {
            this.requirementsFile = requirementsFile;
            return this;
        }

        public Builder withStrategyConfig(Map<String, String> strategyConfig) {
            this.strategyConfig = strategyConfig;
            return this;
        }

        public Builder withTimeout(String timeout) {
            this.timeout = timeout;
            return this;
        }

        public BuildConfig build() {
            return new BuildConfig(enabled, strategy, baseImage, dockerfile, fallbackPolicy, requirementsFile, strategyConfig, timeout);
        }
    }
}
