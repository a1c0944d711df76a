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

package io.mlops.validator.server.build.tekton;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.mlops.validator.api.build.BuildCapability;
import io.mlops.validator.api.build.BuildHandle;
import io.mlops.validator.api.build.BuildInfo;
import io.mlops.validator.api.build.BuildStrategy;
import io.mlops.validator.api.build.ClusterCapabilities;
import io.mlops.validator.api.model.BuildConfig;
import io.mlops.validator.api.model.BuildPhase;
import io.mlops.validator.api.model.NotebookSource;
import io.mlops.validator.api.model.ValidationJobSpec;
import io.mlops.validator.api.service.ValidatorException;
import io.mlops.validator.server.build.BuildConfigChecks;
import io.mlops.validator.server.build.BuildResources;
import io.mlops.validator.server.build.BuildStrategyConfiguration;
import io.mlops.validator.server.kubernetes.ClusterApiFacade;
import io.mlops.validator.server.kubernetes.GenericResources;
import io.mlops.validator.server.kubernetes.ResourceKind;
import io.mlops.validator.server.kubernetes.ResourceLabels;

import static io.mlops.validator.common.util.StringExt.getNonEmptyOrDefault;
import static io.mlops.validator.common.util.StringExt.isNotEmpty;

/**
 * Builds on Tekton pipelines. Each job owns a Pipeline ({@code <job>-pipeline}) that clones the repository, generates
 * a build file if the repository has none, and builds the image with buildah. Each attempt runs it as a PipelineRun
 * ({@code <job>-build-<attempt>}). The git-clone and buildah tasks are resolved from the cluster task catalog.
 */
@Singleton
public class TektonBuildStrategy implements BuildStrategy {

    public static final String NAME = "tekton";

    /**
     * Strategy options accepted in {@code buildConfig.strategyConfig}.
     */
    public static final String OPTION_REGISTRY = "registry";
    public static final String OPTION_TASK_NAMESPACE = "taskNamespace";

    static final String DEFAULT_TASK_NAMESPACE = "openshift-pipelines";
    static final String CREDENTIALS_SECRET_SUFFIX = "-tekton";

    static final String PARAM_GIT_URL = "git-url";
    static final String PARAM_GIT_REVISION = "git-revision";
    static final String PARAM_IMAGE_REFERENCE = "image-reference";
    static final String PARAM_BASE_IMAGE = "base-image";
    static final String PARAM_DOCKERFILE_PATH = "dockerfile-path";

    static final String WORKSPACE_SHARED = "shared-workspace";
    static final String WORKSPACE_GIT_CREDENTIALS = "git-credentials";

    static final String TASK_FETCH = "fetch-repository";
    static final String TASK_GENERATE = "generate-dockerfile";
    static final String TASK_BUILD = "build-image";

    static final String RESULT_IMAGE_DIGEST = "IMAGE_DIGEST";

    private static final long NON_ROOT_FS_GROUP = 65532;

    private final ClusterApiFacade clusterApi;
    private final BuildStrategyConfiguration configuration;
    private final DockerfileGenerator dockerfileGenerator;

    @Inject
    public TektonBuildStrategy(ClusterApiFacade clusterApi, BuildStrategyConfiguration configuration) {
        this.clusterApi = clusterApi;
        this.configuration = configuration;
        this.dockerfileGenerator = new DockerfileGenerator();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getCapabilityDescription() {
        return BuildCapability.TEKTON_PIPELINES.getDiscoveryResource();
    }

    @Override
    public boolean detect(ClusterCapabilities capabilities) {
        return capabilities.isBuildCapabilityAvailable(BuildCapability.TEKTON_PIPELINES);
    }

    @Override
    public void validate(BuildConfig config) {
        BuildConfigChecks.checkCommon(config);
        for (String key : config.getStrategyConfig().keySet()) {
            if (!OPTION_REGISTRY.equals(key) && !OPTION_TASK_NAMESPACE.equals(key)) {
                throw ValidatorException.configurationInvalid(String.format(
                        "unknown tekton strategy option '%s' (supported: %s, %s)", key, OPTION_REGISTRY, OPTION_TASK_NAMESPACE
                ));
            }
        }
        String registry = config.getStrategyConfig().get(OPTION_REGISTRY);
        if (registry != null && (registry.isEmpty() || registry.contains(" ") || registry.endsWith("/"))) {
            throw ValidatorException.configurationInvalid("tekton strategy option 'registry' is not a valid registry host: '" + registry + "'");
        }
    }

    @Override
    public BuildInfo createBuild(BuildHandle handle, ValidationJobSpec spec) {
        BuildConfig config = spec.getBuildConfig();
        Map<String, String> ownedLabels = ImmutableMap.<String, String>builder()
                .putAll(ResourceLabels.buildSelector(handle.getJobId()))
                .put(ResourceLabels.LABEL_OWNER, handle.getJobName())
                .build();

        BuildResources.createOrGet(clusterApi, ResourceKind.TEKTON_PIPELINE, GenericResources.newResource(
                ResourceKind.TEKTON_PIPELINE,
                handle.getNamespace(),
                pipelineName(handle),
                ownedLabels,
                Collections.emptyMap(),
                ResourceLabels.ownerReferences(handle.getJobName(), handle.getJobId()),
                newPipelineSpec(config)
        ));
        GenericKubernetesResource run = BuildResources.createOrGet(clusterApi, ResourceKind.TEKTON_PIPELINE_RUN, GenericResources.newResource(
                ResourceKind.TEKTON_PIPELINE_RUN,
                handle.getNamespace(),
                handle.getBuildName(),
                ResourceLabels.forBuild(handle),
                Collections.emptyMap(),
                ResourceLabels.ownerReferences(handle.getJobName(), handle.getJobId()),
                newPipelineRunSpec(handle, spec)
        ));
        return toBuildInfo(run);
    }

    @Override
    public Optional<BuildInfo> getStatus(BuildHandle handle) {
        List<GenericKubernetesResource> runs = clusterApi.listResources(
                ResourceKind.TEKTON_PIPELINE_RUN, handle.getNamespace(), ResourceLabels.buildAttemptSelector(handle)
        );
        return runs.isEmpty() ? Optional.empty() : Optional.of(toBuildInfo(runs.get(0)));
    }

    @Override
    public Optional<String> getImage(BuildHandle handle) {
        return getStatus(handle)
                .filter(info -> info.getPhase() == BuildPhase.Complete)
                .flatMap(BuildInfo::getImageReference);
    }

    @Override
    public void delete(BuildHandle handle) {
        BuildResources.deleteAll(
                clusterApi,
                ResourceKind.BUILD_KINDS,
                handle.getNamespace(),
                ResourceLabels.buildSelector(handle.getJobId())
        );
    }

    static String pipelineName(BuildHandle handle) {
        return handle.getJobName() + "-pipeline";
    }

    String imageReference(BuildHandle handle, BuildConfig config) {
        String registry = getNonEmptyOrDefault(config.getStrategyConfig().get(OPTION_REGISTRY), configuration.getDefaultRegistry());
        return registry + '/' + handle.getNamespace() + '/' + handle.getBuildBaseName() + ":latest";
    }

    private ObjectNode newPipelineSpec(BuildConfig config) {
        String baseImage = getNonEmptyOrDefault(config.getBaseImage(), configuration.getDefaultBaseImage());
        String taskNamespace = getNonEmptyOrDefault(config.getStrategyConfig().get(OPTION_TASK_NAMESPACE), DEFAULT_TASK_NAMESPACE);

        ObjectNode spec = GenericResources.newObjectNode();
        ArrayNode params = spec.putArray("params");
        params.addObject().put("name", PARAM_GIT_URL).put("type", "string");
        params.addObject().put("name", PARAM_GIT_REVISION).put("type", "string").put("default", NotebookSource.DEFAULT_GIT_REF);
        params.addObject().put("name", PARAM_IMAGE_REFERENCE).put("type", "string");
        params.addObject().put("name", PARAM_BASE_IMAGE).put("type", "string").put("default", baseImage);
        params.addObject().put("name", PARAM_DOCKERFILE_PATH).put("type", "string").put("default", "Dockerfile");

        ArrayNode workspaces = spec.putArray("workspaces");
        workspaces.addObject().put("name", WORKSPACE_SHARED);
        workspaces.addObject().put("name", WORKSPACE_GIT_CREDENTIALS).put("optional", true);

        ArrayNode tasks = spec.putArray("tasks");

        ObjectNode fetch = tasks.addObject();
        fetch.put("name", TASK_FETCH);
        fetch.set("taskRef", clusterTaskRef("git-clone", taskNamespace));
        ArrayNode fetchParams = fetch.putArray("params");
        fetchParams.addObject().put("name", "URL").put("value", "$(params." + PARAM_GIT_URL + ")");
        fetchParams.addObject().put("name", "REVISION").put("value", "$(params." + PARAM_GIT_REVISION + ")");
        ArrayNode fetchWorkspaces = fetch.putArray("workspaces");
        fetchWorkspaces.addObject().put("name", "output").put("workspace", WORKSPACE_SHARED);
        fetchWorkspaces.addObject().put("name", "basic-auth").put("workspace", WORKSPACE_GIT_CREDENTIALS);

        ObjectNode generate = tasks.addObject();
        generate.put("name", TASK_GENERATE);
        generate.putArray("runAfter").add(TASK_FETCH);
        generate.putArray("workspaces").addObject().put("name", "source").put("workspace", WORKSPACE_SHARED);
        ObjectNode generateSpec = generate.putObject("taskSpec");
        generateSpec.putArray("workspaces").addObject().put("name", "source");
        ObjectNode step = generateSpec.putArray("steps").addObject();
        step.put("name", "generate");
        step.put("image", configuration.getDockerfileGeneratorImage());
        step.put("script", dockerfileGenerator.generateScript(config, baseImage));
        step.set("securityContext", restrictedSecurityContext());

        ObjectNode build = tasks.addObject();
        build.put("name", TASK_BUILD);
        build.putArray("runAfter").add(TASK_GENERATE);
        build.set("taskRef", clusterTaskRef("buildah", taskNamespace));
        ArrayNode buildParams = build.putArray("params");
        buildParams.addObject().put("name", "IMAGE").put("value", "$(params." + PARAM_IMAGE_REFERENCE + ")");
        buildParams.addObject().put("name", "DOCKERFILE").put("value", "./Dockerfile");
        buildParams.addObject().put("name", "CONTEXT").put("value", ".");
        build.putArray("workspaces").addObject().put("name", "source").put("workspace", WORKSPACE_SHARED);

        spec.putArray("results").addObject()
                .put("name", RESULT_IMAGE_DIGEST)
                .put("value", "$(tasks." + TASK_BUILD + ".results.IMAGE_DIGEST)");
        return spec;
    }

    private ObjectNode newPipelineRunSpec(BuildHandle handle, ValidationJobSpec jobSpec) {
        BuildConfig config = jobSpec.getBuildConfig();
        NotebookSource notebook = jobSpec.getNotebook();

        ObjectNode spec = GenericResources.newObjectNode();
        spec.putObject("pipelineRef").put("name", pipelineName(handle));

        ArrayNode params = spec.putArray("params");
        params.addObject().put("name", PARAM_GIT_URL).put("value", notebook.getGitUrl());
        params.addObject().put("name", PARAM_GIT_REVISION).put("value", notebook.getGitRef());
        params.addObject().put("name", PARAM_IMAGE_REFERENCE).put("value", imageReference(handle, config));
        if (isNotEmpty(config.getDockerfile())) {
            params.addObject().put("name", PARAM_DOCKERFILE_PATH).put("value", config.getDockerfile());
        }

        ArrayNode workspaces = spec.putArray("workspaces");
        ObjectNode shared = workspaces.addObject();
        shared.put("name", WORKSPACE_SHARED);
        ObjectNode claimSpec = shared.putObject("volumeClaimTemplate").putObject("spec");
        claimSpec.putArray("accessModes").add("ReadWriteOnce");
        claimSpec.putObject("resources").putObject("requests").put("storage", configuration.getPipelineWorkspaceSize());
        if (isNotEmpty(notebook.getCredentialsSecret())) {
            workspaces.addObject()
                    .put("name", WORKSPACE_GIT_CREDENTIALS)
                    .putObject("secret").put("secretName", notebook.getCredentialsSecret() + CREDENTIALS_SECRET_SUFFIX);
        }

        ObjectNode taskRunTemplate = spec.putObject("taskRunTemplate");
        taskRunTemplate.put("serviceAccountName", jobSpec.getPodConfig().getServiceAccountName());
        taskRunTemplate.putObject("podTemplate").putObject("securityContext").put("fsGroup", NON_ROOT_FS_GROUP);
        return spec;
    }

    private static ObjectNode clusterTaskRef(String taskName, String taskNamespace) {
        ObjectNode taskRef = GenericResources.newObjectNode();
        taskRef.put("resolver", "cluster");
        ArrayNode params = taskRef.putArray("params");
        params.addObject().put("name", "kind").put("value", "task");
        params.addObject().put("name", "name").put("value", taskName);
        params.addObject().put("name", "namespace").put("value", taskNamespace);
        return taskRef;
    }

    private static ObjectNode restrictedSecurityContext() {
        ObjectNode securityContext = GenericResources.newObjectNode();
        securityContext.put("runAsNonRoot", true);
        securityContext.put("allowPrivilegeEscalation", false);
        securityContext.putObject("capabilities").putArray("drop").add("ALL");
        return securityContext;
    }

    static BuildInfo toBuildInfo(GenericKubernetesResource run) {
        JsonNode tree = GenericResources.toTree(run);
        JsonNode succeeded = null;
        for (JsonNode condition : tree.at("/status/conditions")) {
            if ("Succeeded".equals(condition.path("type").asText())) {
                succeeded = condition;
            }
        }
        BuildPhase phase;
        String message = "";
        if (succeeded == null) {
            phase = BuildPhase.Pending;
        } else {
            phase = toBuildPhase(succeeded.path("status").asText(), succeeded.path("reason").asText());
            message = succeeded.path("message").asText("");
        }

        String image = null;
        if (phase == BuildPhase.Complete) {
            String digest = null;
            for (JsonNode result : tree.at("/status/results")) {
                if (RESULT_IMAGE_DIGEST.equals(result.path("name").asText())) {
                    digest = result.path("value").asText(null);
                }
            }
            for (JsonNode param : tree.at("/spec/params")) {
                if (PARAM_IMAGE_REFERENCE.equals(param.path("name").asText())) {
                    image = BuildResources.pinDigest(param.path("value").asText(), digest);
                }
            }
        }
        return new BuildInfo(
                GenericResources.nameOf(run),
                phase,
                message,
                image,
                GenericResources.time(tree, "/status/startTime"),
                GenericResources.time(tree, "/status/completionTime")
        );
    }

    static BuildPhase toBuildPhase(String status, String reason) {
        String lowerReason = reason.toLowerCase(Locale.ROOT);
        switch (status) {
            case "True":
                return BuildPhase.Complete;
            case "False":
                return lowerReason.contains("cancelled") ? BuildPhase.Cancelled : BuildPhase.Failed;
            case "Unknown":
                return lowerReason.contains("pending") ? BuildPhase.Pending : BuildPhase.Running;
            default:
                return BuildPhase.Pending;
        }
    }
}
