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

package io.mlops.validator.server.execution;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.io.Resources;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.EnvFromSource;
import io.fabric8.kubernetes.api.model.EnvFromSourceBuilder;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.EnvVarBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.SecurityContext;
import io.fabric8.kubernetes.api.model.SecurityContextBuilder;
import io.fabric8.kubernetes.api.model.VolumeMount;
import io.fabric8.kubernetes.api.model.VolumeMountBuilder;
import io.mlops.validator.api.model.EnvVariable;
import io.mlops.validator.api.model.ModelValidationConfig;
import io.mlops.validator.api.model.NotebookSource;
import io.mlops.validator.api.model.PodConfig;
import io.mlops.validator.api.model.ValidationJob;
import io.mlops.validator.server.build.BuildStrategyConfiguration;
import io.mlops.validator.server.build.tekton.DockerfileGenerator;
import io.mlops.validator.server.kubernetes.ResourceLabels;

import static io.mlops.validator.common.util.StringExt.isNotEmpty;

/**
 * Creates validation pod definitions. A pod runs the notebook of one job attempt with papermill, either from a built
 * image (the notebook is part of the image) or from the configured image with the repository cloned by an init
 * container.
 */
@Singleton
public class ValidationPodFactory {

    public static final String VALIDATOR_CONTAINER = "validator";
    public static final String GIT_CLONE_CONTAINER = "git-clone";

    static final String WORKSPACE_VOLUME = "workspace";
    static final String WORKSPACE_PATH = "/workspace";
    static final String HOME_VOLUME = "jovyan-home";
    static final String HOME_PATH = "/home/jovyan";
    static final String CLONED_REPOSITORY_PATH = WORKSPACE_PATH + "/repo";
    static final String OUTPUT_NOTEBOOK = WORKSPACE_PATH + "/output.ipynb";
    static final String RESULTS_JSON = WORKSPACE_PATH + "/results.json";

    private static final String GIT_CLONE_SCRIPT = loadScript("scripts/git-clone.sh");
    private static final String RUN_NOTEBOOK_SCRIPT = loadScript("scripts/run-notebook.sh");

    private final BuildStrategyConfiguration buildConfiguration;

    @Inject
    public ValidationPodFactory(BuildStrategyConfiguration buildConfiguration) {
        this.buildConfiguration = buildConfiguration;
    }

    public static String podName(ValidationJob job, int attempt) {
        return job.getName() + "-validation-" + attempt;
    }

    /**
     * Location of the notebook inside the validator container.
     */
    public static String notebookPath(ValidationJob job, boolean builtImage) {
        String root = builtImage ? DockerfileGenerator.APP_ROOT : CLONED_REPOSITORY_PATH;
        return root + '/' + job.getSpec().getNotebook().getPath();
    }

    public Pod newValidationPod(ValidationJob job, int attempt, String image, boolean builtImage) {
        PodConfig podConfig = job.getSpec().getPodConfig();

        List<Container> initContainers = builtImage
                ? Collections.emptyList()
                : Collections.singletonList(newGitCloneContainer(job.getSpec().getNotebook()));

        return new PodBuilder()
                .withNewMetadata()
                .withNamespace(job.getNamespace())
                .withName(podName(job, attempt))
                .withLabels(ResourceLabels.forValidationPod(job, attempt))
                .withOwnerReferences(ResourceLabels.ownerReferences(job.getName(), job.getUid()))
                .endMetadata()
                .withNewSpec()
                .withRestartPolicy("Never")
                .withServiceAccountName(podConfig.getServiceAccountName())
                .withNewSecurityContext()
                .withRunAsNonRoot(true)
                .withNewSeccompProfile().withType("RuntimeDefault").endSeccompProfile()
                .endSecurityContext()
                .withInitContainers(initContainers)
                .withContainers(newValidatorContainer(job, image, builtImage))
                .addNewVolume().withName(WORKSPACE_VOLUME).withNewEmptyDir().endEmptyDir().endVolume()
                .addNewVolume().withName(HOME_VOLUME).withNewEmptyDir().endEmptyDir().endVolume()
                .endSpec()
                .build();
    }

    private Container newGitCloneContainer(NotebookSource notebook) {
        List<EnvVar> env = new ArrayList<>();
        env.add(new EnvVar("GIT_URL", notebook.getGitUrl(), null));
        env.add(new EnvVar("GIT_REF", notebook.getGitRef(), null));
        if (isNotEmpty(notebook.getCredentialsSecret())) {
            env.add(optionalSecretEnv("GIT_USERNAME", notebook.getCredentialsSecret(), "username"));
            env.add(optionalSecretEnv("GIT_PASSWORD", notebook.getCredentialsSecret(), "password"));
            env.add(optionalSecretEnv("GIT_TOKEN", notebook.getCredentialsSecret(), "token"));
        }
        return new ContainerBuilder()
                .withName(GIT_CLONE_CONTAINER)
                .withImage(buildConfiguration.getGitCloneImage())
                .withCommand("/bin/sh", "-c", GIT_CLONE_SCRIPT)
                .withEnv(env)
                .withVolumeMounts(workspaceMount())
                .withSecurityContext(restrictedSecurityContext())
                .build();
    }

    private Container newValidatorContainer(ValidationJob job, String image, boolean builtImage) {
        PodConfig podConfig = job.getSpec().getPodConfig();

        List<EnvVar> env = new ArrayList<>();
        env.add(new EnvVar("INPUT_NOTEBOOK", notebookPath(job, builtImage), null));
        env.add(new EnvVar("OUTPUT_NOTEBOOK", OUTPUT_NOTEBOOK, null));
        env.add(new EnvVar("RESULTS_JSON", RESULTS_JSON, null));
        env.add(new EnvVar("HOME", HOME_PATH, null));
        env.add(new EnvVar("PYTHONUSERBASE", HOME_PATH + "/.local", null));
        env.addAll(modelValidationEnv(job));
        for (EnvVariable variable : podConfig.getEnv()) {
            env.add(toEnvVar(variable));
        }

        List<EnvFromSource> envFrom = new ArrayList<>();
        for (String secret : podConfig.getEnvFromSecrets()) {
            envFrom.add(new EnvFromSourceBuilder().withNewSecretRef().withName(secret).endSecretRef().build());
        }
        for (String configMap : podConfig.getEnvFromConfigMaps()) {
            envFrom.add(new EnvFromSourceBuilder().withNewConfigMapRef().withName(configMap).endConfigMapRef().build());
        }
        for (String credential : podConfig.getCredentials()) {
            envFrom.add(new EnvFromSourceBuilder().withNewSecretRef().withName(credential).endSecretRef().build());
        }

        return new ContainerBuilder()
                .withName(VALIDATOR_CONTAINER)
                .withImage(image)
                .withCommand("/bin/bash", "-c", RUN_NOTEBOOK_SCRIPT)
                .withEnv(env)
                .withEnvFrom(envFrom)
                .withNewResources()
                .withLimits(toQuantities(podConfig.getResourceLimits()))
                .withRequests(toQuantities(podConfig.getResourceRequests()))
                .endResources()
                .withVolumeMounts(
                        workspaceMount(),
                        new VolumeMountBuilder().withName(HOME_VOLUME).withMountPath(HOME_PATH).build()
                )
                .withSecurityContext(restrictedSecurityContext())
                .build();
    }

    /**
     * Model validation settings for the notebook. Target models without a namespace are resolved to the job namespace.
     */
    static List<EnvVar> modelValidationEnv(ValidationJob job) {
        ModelValidationConfig config = job.getSpec().getModelValidation();
        if (!config.isEnabled()) {
            return Collections.emptyList();
        }
        List<EnvVar> env = new ArrayList<>();
        env.add(new EnvVar("MODEL_VALIDATION_ENABLED", "true", null));
        env.add(new EnvVar("MODEL_VALIDATION_PLATFORM", config.getPlatform(), null));
        env.add(new EnvVar("MODEL_VALIDATION_NAMESPACE", job.getNamespace(), null));
        env.add(new EnvVar("MODEL_VALIDATION_PHASE", config.getPhase(), null));
        env.add(new EnvVar("MODEL_VALIDATION_TIMEOUT", config.getTimeout(), null));
        job.getStatus().getModelValidationResult().ifPresent(result ->
                env.add(new EnvVar("MODEL_VALIDATION_PLATFORM_DETECTED", Boolean.toString(result.isPlatformDetected()), null))
        );
        if (!config.getTargetModels().isEmpty()) {
            Set<String> namespaces = new TreeSet<>();
            List<String> resolved = new ArrayList<>();
            for (String model : config.getTargetModels()) {
                String qualified = model.contains("/") ? model : job.getNamespace() + '/' + model;
                resolved.add(qualified);
                namespaces.add(qualified.substring(0, qualified.indexOf('/')));
            }
            env.add(new EnvVar("MODEL_VALIDATION_TARGET_MODELS", String.join(",", resolved), null));
            env.add(new EnvVar("MODEL_VALIDATION_TARGET_NAMESPACES", String.join(",", namespaces), null));
        }
        return env;
    }

    private static EnvVar toEnvVar(EnvVariable variable) {
        if (variable.getSecretName() != null) {
            return new EnvVarBuilder()
                    .withName(variable.getName())
                    .withNewValueFrom()
                    .withNewSecretKeyRef().withName(variable.getSecretName()).withKey(variable.getKey()).endSecretKeyRef()
                    .endValueFrom()
                    .build();
        }
        if (variable.getConfigMapName() != null) {
            return new EnvVarBuilder()
                    .withName(variable.getName())
                    .withNewValueFrom()
                    .withNewConfigMapKeyRef().withName(variable.getConfigMapName()).withKey(variable.getKey()).endConfigMapKeyRef()
                    .endValueFrom()
                    .build();
        }
        return new EnvVar(variable.getName(), variable.getValue(), null);
    }

    private static EnvVar optionalSecretEnv(String name, String secretName, String key) {
        return new EnvVarBuilder()
                .withName(name)
                .withNewValueFrom()
                .withNewSecretKeyRef().withName(secretName).withKey(key).withOptional(true).endSecretKeyRef()
                .endValueFrom()
                .build();
    }

    private static Map<String, Quantity> toQuantities(Map<String, String> values) {
        Map<String, Quantity> quantities = new HashMap<>();
        values.forEach((name, value) -> quantities.put(name, new Quantity(value)));
        return quantities;
    }

    private static VolumeMount workspaceMount() {
        return new VolumeMountBuilder().withName(WORKSPACE_VOLUME).withMountPath(WORKSPACE_PATH).build();
    }

    private static SecurityContext restrictedSecurityContext() {
        return new SecurityContextBuilder()
                .withRunAsNonRoot(true)
                .withAllowPrivilegeEscalation(false)
                .withNewCapabilities().withDrop("ALL").endCapabilities()
                .build();
    }

    private static String loadScript(String resource) {
        try {
            return Resources.toString(Resources.getResource(ValidationPodFactory.class, "/" + resource), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load script " + resource, e);
        }
    }
}
