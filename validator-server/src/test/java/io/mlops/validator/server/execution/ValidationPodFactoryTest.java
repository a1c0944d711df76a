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

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Quantity;
import io.mlops.validator.api.model.EnvVariable;
import io.mlops.validator.api.model.ValidationJob;
import io.mlops.validator.common.util.archaius2.Archaius2Ext;
import io.mlops.validator.server.ValidationJobGenerator;
import io.mlops.validator.server.build.BuildStrategyConfiguration;
import io.mlops.validator.server.build.tekton.DockerfileGenerator;
import io.mlops.validator.server.kubernetes.ResourceLabels;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ValidationPodFactoryTest {

    private final ValidationPodFactory factory = new ValidationPodFactory(Archaius2Ext.newConfiguration(BuildStrategyConfiguration.class));

    @Test
    public void testPodForPrebuiltImage() {
        ValidationJob job = ValidationJobGenerator.prebuiltImageJob("churn");
        Pod pod = factory.newValidationPod(job, 2, ValidationJobGenerator.CONTAINER_IMAGE, false);

        assertThat(pod.getMetadata().getName()).isEqualTo("churn-validation-2");
        assertThat(pod.getMetadata().getLabels())
                .containsEntry(ResourceLabels.LABEL_JOB_ID, "uid-churn")
                .containsEntry(ResourceLabels.LABEL_COMPONENT, ResourceLabels.COMPONENT_VALIDATION)
                .containsEntry(ResourceLabels.LABEL_ATTEMPT, "2");
        assertThat(pod.getMetadata().getOwnerReferences()).hasSize(1);
        OwnerReference owner = pod.getMetadata().getOwnerReferences().get(0);
        assertThat(owner.getKind()).isEqualTo("NotebookValidationJob");
        assertThat(owner.getApiVersion()).isEqualTo("mlops.mlops.dev/v1alpha1");
        assertThat(owner.getName()).isEqualTo("churn");
        assertThat(owner.getUid()).isEqualTo("uid-churn");
        assertThat(owner.getController()).isTrue();
        assertThat(pod.getSpec().getRestartPolicy()).isEqualTo("Never");
        assertThat(pod.getSpec().getSecurityContext().getRunAsNonRoot()).isTrue();

        assertThat(pod.getSpec().getInitContainers()).hasSize(1);
        Container gitClone = pod.getSpec().getInitContainers().get(0);
        assertThat(gitClone.getName()).isEqualTo(ValidationPodFactory.GIT_CLONE_CONTAINER);
        assertThat(envOf(gitClone).get("GIT_URL").getValue()).isEqualTo(ValidationJobGenerator.GIT_URL);
        assertThat(gitClone.getCommand().get(2)).contains("echo \"Cloning $SAFE_URL").doesNotContain("echo \"Cloning $GIT_URL");

        Container validator = pod.getSpec().getContainers().get(0);
        assertThat(validator.getImage()).isEqualTo(ValidationJobGenerator.CONTAINER_IMAGE);
        assertThat(validator.getCommand().get(2)).contains("papermill").contains(ResultCollector.SUMMARY_MARKER);
        assertThat(envOf(validator).get("INPUT_NOTEBOOK").getValue()).isEqualTo("/workspace/repo/" + ValidationJobGenerator.NOTEBOOK_PATH);
        assertThat(envOf(validator).get("MODEL_STAGE").getValue()).isEqualTo("test");
        assertThat(validator.getResources().getLimits().get("memory")).isEqualTo(new Quantity("4Gi"));
        assertThat(validator.getSecurityContext().getAllowPrivilegeEscalation()).isFalse();
        assertThat(validator.getSecurityContext().getCapabilities().getDrop()).containsExactly("ALL");
    }

    @Test
    public void testNoOwnerReferenceWithoutJobUid() {
        ValidationJob job = ValidationJobGenerator.prebuiltImageJob("churn").toBuilder().withUid("").build();
        Pod pod = factory.newValidationPod(job, 1, ValidationJobGenerator.CONTAINER_IMAGE, false);

        assertThat(pod.getMetadata().getOwnerReferences()).isEmpty();
    }

    @Test
    public void testPodForBuiltImageSkipsGitClone() {
        ValidationJob job = ValidationJobGenerator.buildJob("churn", "s2i");
        Pod pod = factory.newValidationPod(job, 1, "registry/ml-team/churn-build@sha256:abc", true);

        assertThat(pod.getSpec().getInitContainers()).isEmpty();
        Container validator = pod.getSpec().getContainers().get(0);
        assertThat(envOf(validator).get("INPUT_NOTEBOOK").getValue())
                .isEqualTo(DockerfileGenerator.APP_ROOT + '/' + ValidationJobGenerator.NOTEBOOK_PATH);
    }

    @Test
    public void testGitCredentialsAreOptionalSecretKeys() {
        ValidationJob job = ValidationJobGenerator.buildJob("churn", "s2i");
        Pod pod = factory.newValidationPod(job, 1, ValidationJobGenerator.CONTAINER_IMAGE, false);

        Map<String, EnvVar> env = envOf(pod.getSpec().getInitContainers().get(0));
        assertThat(env.get("GIT_TOKEN").getValueFrom().getSecretKeyRef().getName()).isEqualTo("git-credentials");
        assertThat(env.get("GIT_TOKEN").getValueFrom().getSecretKeyRef().getOptional()).isTrue();
    }

    @Test
    public void testEnvironmentSources() {
        ValidationJob job = ValidationJobGenerator.newJob("churn", ValidationJobGenerator.prebuiltImageSpec().toBuilder()
                .withPodConfig(ValidationJobGenerator.prebuiltImageSpec().getPodConfig().toBuilder()
                        .withEnv(Arrays.asList(
                                EnvVariable.fromSecret("DB_PASSWORD", "db", "password"),
                                EnvVariable.fromConfigMap("REGION", "settings", "region")
                        ))
                        .withEnvFromSecrets(Arrays.asList("aws"))
                        .withCredentials(Arrays.asList("s3-credentials"))
                        .withEnvFromConfigMaps(Arrays.asList("feature-flags"))
                        .build()
                )
                .build()
        );
        Container validator = factory.newValidationPod(job, 1, ValidationJobGenerator.CONTAINER_IMAGE, false).getSpec().getContainers().get(0);

        Map<String, EnvVar> env = envOf(validator);
        assertThat(env.get("DB_PASSWORD").getValueFrom().getSecretKeyRef().getKey()).isEqualTo("password");
        assertThat(env.get("REGION").getValueFrom().getConfigMapKeyRef().getName()).isEqualTo("settings");
        assertThat(validator.getEnvFrom()).hasSize(3);
        assertThat(validator.getEnvFrom().get(0).getSecretRef().getName()).isEqualTo("aws");
        assertThat(validator.getEnvFrom().get(1).getConfigMapRef().getName()).isEqualTo("feature-flags");
        assertThat(validator.getEnvFrom().get(2).getSecretRef().getName()).isEqualTo("s3-credentials");
    }

    @Test
    public void testModelValidationEnvironment() {
        ValidationJob job = ValidationJobGenerator.newJob("churn",
                ValidationJobGenerator.modelValidationSpec("kserve", "fraud-model", "ml-team/churn-model"));
        Container validator = factory.newValidationPod(job, 1, ValidationJobGenerator.CONTAINER_IMAGE, false).getSpec().getContainers().get(0);

        Map<String, EnvVar> env = envOf(validator);
        assertThat(env.get("MODEL_VALIDATION_ENABLED").getValue()).isEqualTo("true");
        assertThat(env.get("MODEL_VALIDATION_PLATFORM").getValue()).isEqualTo("kserve");
        assertThat(env.get("MODEL_VALIDATION_NAMESPACE").getValue()).isEqualTo(ValidationJobGenerator.NAMESPACE);
        assertThat(env.get("MODEL_VALIDATION_PHASE").getValue()).isEqualTo("both");
        assertThat(env.get("MODEL_VALIDATION_TIMEOUT").getValue()).isEqualTo("5m");
        assertThat(env.get("MODEL_VALIDATION_TARGET_MODELS").getValue()).isEqualTo("ml-team/fraud-model,ml-team/churn-model");
        assertThat(env.get("MODEL_VALIDATION_TARGET_NAMESPACES").getValue()).isEqualTo("ml-team");
        assertThat(env).doesNotContainKey("MODEL_VALIDATION_PLATFORM_DETECTED");
    }

    @Test
    public void testNoModelValidationEnvironmentWhenDisabled() {
        Container validator = factory.newValidationPod(ValidationJobGenerator.prebuiltImageJob("churn"), 1, ValidationJobGenerator.CONTAINER_IMAGE, false)
                .getSpec().getContainers().get(0);

        assertThat(envOf(validator).keySet()).noneMatch(name -> name.startsWith("MODEL_VALIDATION_"));
    }

    private static Map<String, EnvVar> envOf(Container container) {
        return container.getEnv().stream().collect(Collectors.toMap(EnvVar::getName, Function.identity()));
    }
}
