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

/**
 * Image build subsystems a cluster may offer.
 */
public enum BuildCapability {

    /**
     * OpenShift builds API (build.openshift.io BuildConfig/Build, image.openshift.io ImageStream).
     */
    OPENSHIFT_BUILDS("build.openshift.io/v1 BuildConfig"),

    /**
     * Tekton pipelines API (tekton.dev Pipeline/PipelineRun).
     */
    TEKTON_PIPELINES("tekton.dev/v1 Pipeline");

    private final String discoveryResource;

    BuildCapability(String discoveryResource) {
        this.discoveryResource = discoveryResource;
    }

    /**
     * Resource whose presence in the cluster API discovery proves the capability.
     */
    public String getDiscoveryResource() {
        return discoveryResource;
    }
}
