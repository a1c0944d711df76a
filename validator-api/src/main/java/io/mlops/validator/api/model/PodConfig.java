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
import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Validation pod configuration. Credentials and env-from entries are secret or config map names passed through
 * to the pod without resolution.
 */
public class PodConfig {

    public static final String DEFAULT_SERVICE_ACCOUNT = "jupyter-notebook-validator-runner";

    private final String containerImage;
    private final Map<String, String> resourceLimits;
    private final Map<String, String> resourceRequests;
    private final String serviceAccountName;
    private final List<EnvVariable> env;
    private final List<String> envFromSecrets;
    private final List<String> envFromConfigMaps;
    private final List<String> credentials;
    private final BuildConfig buildConfig;

    public PodConfig(String containerImage,
                     Map<String, String> resourceLimits,
                     Map<String, String> resourceRequests,
                     String serviceAccountName,
                     List<EnvVariable> env,
                     List<String> envFromSecrets,
                     List<String> envFromConfigMaps,
                     List<String> credentials,
                     BuildConfig buildConfig) {
        this.containerImage = containerImage;
        this.resourceLimits = resourceLimits == null ? Collections.emptyMap() : ImmutableMap.copyOf(resourceLimits);
        this.resourceRequests = resourceRequests == null ? Collections.emptyMap() : ImmutableMap.copyOf(resourceRequests);
        this.serviceAccountName = serviceAccountName == null || serviceAccountName.isEmpty() ? DEFAULT_SERVICE_ACCOUNT : serviceAccountName;
        this.env = env == null ? Collections.emptyList() : ImmutableList.copyOf(env);
        this.envFromSecrets = envFromSecrets == null ? Collections.emptyList() : ImmutableList.copyOf(envFromSecrets);
        this.envFromConfigMaps = envFromConfigMaps == null ? Collections.emptyList() : ImmutableList.copyOf(envFromConfigMaps);
        this.credentials = credentials == null ? Collections.emptyList() : ImmutableList.copyOf(credentials);
        this.buildConfig = buildConfig == null ? BuildConfig.disabled() : buildConfig;
    }

    public String getContainerImage() {
        return containerImage;
    }

    public Map<String, String> getResourceLimits() {
        return resourceLimits;
    }

    public Map<String, String> getResourceRequests() {
        return resourceRequests;
    }

    public String getServiceAccountName() {
        return serviceAccountName;
    }

    public List<EnvVariable> getEnv() {
        return env;
    }

    public List<String> getEnvFromSecrets() {
        return envFromSecrets;
    }

    public List<String> getEnvFromConfigMaps() {
        return envFromConfigMaps;
    }

    public List<String> getCredentials() {
        return credentials;
    }

    public BuildConfig getBuildConfig() {
        return buildConfig;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PodConfig podConfig = (PodConfig) o;
        return Objects.equals(containerImage, podConfig.containerImage) &&
                Objects.equals(resourceLimits, podConfig.resourceLimits) &&
                Objects.equals(resourceRequests, podConfig.resourceRequests) &&
                Objects.equals(serviceAccountName, podConfig.serviceAccountName) &&
                Objects.equals(env, podConfig.env) &&
                Objects.equals(envFromSecrets, podConfig.envFromSecrets) &&
                Objects.equals(envFromConfigMaps, podConfig.envFromConfigMaps) &&
                Objects.equals(credentials, podConfig.credentials) &&
                Objects.equals(buildConfig, podConfig.buildConfig);
    }

    @Override
    public int hashCode() {
        return Objects.hash(containerImage, resourceLimits, resourceRequests, serviceAccountName, env, envFromSecrets,
                envFromConfigMaps, credentials, buildConfig);
    }

    @Override
    public String toString() {
        return "PodConfig{" +
                "containerImage='" + containerImage + '\'' +
                ", resourceLimits=" + resourceLimits +
                ", resourceRequests=" + resourceRequests +
                ", serviceAccountName='" + serviceAccountName + '\'' +
                ", env=" + env +
                ", envFromSecrets=" + envFromSecrets +
                ", envFromConfigMaps=" + envFromConfigMaps +
                ", credentials=" + credentials +
                ", buildConfig=" + buildConfig +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withContainerImage(containerImage)
                .withResourceLimits(resourceLimits)
                .withResourceRequests(resourceRequests)
                .withServiceAccountName(serviceAccountName)
                .withEnv(env)
                .withEnvFromSecrets(envFromSecrets)
                .withEnvFromConfigMaps(envFromConfigMaps)
                .withCredentials(credentials)
                .withBuildConfig(buildConfig);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String containerImage;
        private Map<String, String> resourceLimits;
        private Map<String, String> resourceRequests;
        private String serviceAccountName;
        private List<EnvVariable> env;
        private List<String> envFromSecrets;
        private List<String> envFromConfigMaps;
        private List<String> credentials;
        private BuildConfig buildConfig;

        private Builder() {
        }

        public Builder withContainerImage(String containerImage) {
            this.containerImage = containerImage;
            return this;
        }

        public Builder withResourceLimits(Map<String, String> resourceLimits) {
            this.resourceLimits = resourceLimits;
            return this;
        }

        public Builder withResourceRequests(Map<String, String> resourceRequests) {
            this.resourceRequests = resourceRequests;
            return this;
        }

        public Builder withServiceAccountName(String serviceAccountName) {
            this.serviceAccountName = serviceAccountName;
            return this;
        }

        public Builder withEnv(List<EnvVariable> env) {
            this.env = env;
            return this;
        }

        public Builder withEnvFromSecrets(List<String> envFromSecrets) {
            this.envFromSecrets = envFromSecrets;
            return this;
        }

        public Builder withEnvFromConfigMaps(List<String> envFromConfigMaps) {
            this.envFromConfigMaps = envFromConfigMaps;
            return this;
        }

        public Builder withCredentials(List<String> credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder withBuildConfig(BuildConfig buildConfig) {
            this.buildConfig = buildConfig;
            return this;
        }

        public PodConfig build() {
            return new PodConfig(containerImage, resourceLimits, resourceRequests, serviceAccountName, env,
                    envFromSecrets, envFromConfigMaps, credentials, buildConfig);
        }
    }
}
