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

/**
 * Immutable, user provided part of a validation job.
 */
public class ValidationJobSpec {

    public static final String DEFAULT_TIMEOUT = "30m";

    private final NotebookSource notebook;
    private final PodConfig podConfig;
    private final String timeout;
    private final ModelValidationConfig modelValidation;

    public ValidationJobSpec(NotebookSource notebook, PodConfig podConfig, String timeout, ModelValidationConfig modelValidation) {
        this.notebook = notebook;
        this.podConfig = podConfig == null ? PodConfig.newBuilder().build() : podConfig;
        this.timeout = timeout == null || timeout.isEmpty() ? DEFAULT_TIMEOUT : timeout;
        this.modelValidation = modelValidation == null ? ModelValidationConfig.disabled() : modelValidation;
    }

    public NotebookSource getNotebook() {
        return notebook;
    }

    public PodConfig getPodConfig() {
        return podConfig;
    }

    public BuildConfig getBuildConfig() {
        return podConfig.getBuildConfig();
    }

    public boolean isBuildEnabled() {
        return podConfig.getBuildConfig().isEnabled();
    }

    /**
     * Overall wall clock limit of the job as a duration string, for example "30m".
     */
    public String getTimeout() {
        return timeout;
    }

    public ModelValidationConfig getModelValidation() {
        return modelValidation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ValidationJobSpec that = (ValidationJobSpec) o;
        return Objects.equals(notebook, that.notebook) &&
                Objects.equals(podConfig, that.podConfig) &&
                Objects.equals(timeout, that.timeout) &&
                Objects.equals(modelValidation, that.modelValidation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(notebook, podConfig, timeout, modelValidation);
    }

    @Override
    public String toString() {
        return "ValidationJobSpec{" +
                "notebook=" + notebook +
                ", podConfig=" + podConfig +
                ", timeout='" + timeout + '\'' +
                ", modelValidation=" + modelValidation +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder().withNotebook(notebook).withPodConfig(podConfig).withTimeout(timeout).withModelValidation(modelValidation);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private NotebookSource notebook;
        private PodConfig podConfig;
        private String timeout;
        private ModelValidationConfig modelValidation;

        private Builder() {
        }

        public Builder withNotebook(NotebookSource notebook) {
            this.notebook = notebook;
            return this;
        }

        public Builder withPodConfig(PodConfig podConfig) {
            this.podConfig = podConfig;
            return this;
        }

        public Builder withTimeout(String timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withModelValidation(ModelValidationConfig modelValidation) {
            this.modelValidation = modelValidation;
            return this;
        }

        public ValidationJobSpec build() {
            return new ValidationJobSpec(notebook, podConfig, timeout, modelValidation);
        }
    }
}
