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

import java.util.EnumSet;
import java.util.Set;

import io.fabric8.kubernetes.client.dsl.base.CustomResourceDefinitionContext;

/**
 * Custom resource kinds the controller reads or writes through the generic resource API.
 */
public enum ResourceKind {

    VALIDATION_JOB("mlops.mlops.dev", "v1alpha1", "NotebookValidationJob", "notebookvalidationjobs"),

    OPENSHIFT_BUILD_CONFIG("build.openshift.io", "v1", "BuildConfig", "buildconfigs"),
    OPENSHIFT_BUILD("build.openshift.io", "v1", "Build", "builds"),
    OPENSHIFT_IMAGE_STREAM("image.openshift.io", "v1", "ImageStream", "imagestreams"),

    TEKTON_PIPELINE("tekton.dev", "v1", "Pipeline", "pipelines"),
    TEKTON_PIPELINE_RUN("tekton.dev", "v1", "PipelineRun", "pipelineruns"),

    KSERVE_INFERENCE_SERVICE("serving.kserve.io", "v1beta1", "InferenceService", "inferenceservices"),
    RAY_SERVICE("ray.io", "v1", "RayService", "rayservices"),
    SELDON_DEPLOYMENT("machinelearning.seldon.io", "v1", "SeldonDeployment", "seldondeployments"),
    BENTOML_BENTO("serving.yatai.ai", "v1alpha1", "Bento", "bentos");

    /**
     * Kinds that may hold build resources of a job, in deletion order (runs before their templates).
     */
    public static final Set<ResourceKind> BUILD_KINDS = EnumSet.of(
            OPENSHIFT_BUILD, OPENSHIFT_BUILD_CONFIG, OPENSHIFT_IMAGE_STREAM, TEKTON_PIPELINE_RUN, TEKTON_PIPELINE
    );

    private final String group;
    private final String version;
    private final String kind;
    private final String plural;
    private final CustomResourceDefinitionContext context;

    ResourceKind(String group, String version, String kind, String plural) {
        this.group = group;
        this.version = version;
        this.kind = kind;
        this.plural = plural;
        this.context = new CustomResourceDefinitionContext.Builder()
                .withGroup(group)
                .withVersion(version)
                .withKind(kind)
                .withPlural(plural)
                .withScope("Namespaced")
                .build();
    }

    public String getGroup() {
        return group;
    }

    public String getVersion() {
        return version;
    }

    public String getKind() {
        return kind;
    }

    public String getPlural() {
        return plural;
    }

    public String getApiVersion() {
        return group + "/" + version;
    }

    public CustomResourceDefinitionContext getContext() {
        return context;
    }
}
