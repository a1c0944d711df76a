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

package io.mlops.validator.server.build.s2i;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.fasterxml.jackson.databind.JsonNode;
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
 * Source-to-image builds on the OpenShift build subsystem. Each job owns an ImageStream and a BuildConfig
 * ({@code <job>-build}), and each attempt a Build ({@code <job>-build-<attempt>}).
 */
@Singleton
public class S2iBuildStrategy implements BuildStrategy {

    public static final String NAME = "s2i";

    private static final String OUTPUT_TAG = "latest";
    private static final String BUILD_CONFIG_ANNOTATION = "openshift.io/build-config.name";
    private static final String BUILD_CONFIG_LABEL = "buildconfig";

    private final ClusterApiFacade clusterApi;
    private final BuildStrategyConfiguration configuration;

    @Inject
    public S2iBuildStrategy(ClusterApiFacade clusterApi, BuildStrategyConfiguration configuration) {
        this.clusterApi = clusterApi;
        this.configuration = configuration;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getCapabilityDescription() {
        return BuildCapability.OPENSHIFT_BUILDS.getDiscoveryResource();
    }

    @Override
    public boolean detect(ClusterCapabilities capabilities) {
        return capabilities.isBuildCapabilityAvailable(BuildCapability.OPENSHIFT_BUILDS);
    }

    @Override
    public void validate(BuildConfig config) {
        BuildConfigChecks.checkCommon(config);
    }

    @Override
    public BuildInfo createBuild(BuildHandle handle, ValidationJobSpec spec) {
        BuildConfig config = spec.getBuildConfig();
        Map<String, String> jobLabels = ResourceLabels.buildSelector(handle.getJobId());
        Map<String, String> ownedLabels = ImmutableMap.<String, String>builder()
                .putAll(jobLabels)
                .put(ResourceLabels.LABEL_OWNER, handle.getJobName())
                .build();

        BuildResources.createOrGet(clusterApi, ResourceKind.OPENSHIFT_IMAGE_STREAM, newImageStream(handle, ownedLabels));
        BuildResources.createOrGet(clusterApi, ResourceKind.OPENSHIFT_BUILD_CONFIG, GenericResources.newResource(
                ResourceKind.OPENSHIFT_BUILD_CONFIG,
                handle.getNamespace(),
                handle.getBuildBaseName(),
                ownedLabels,
                Collections.emptyMap(),
                ResourceLabels.ownerReferences(handle.getJobName(), handle.getJobId()),
                newBuildSpec(handle, spec, config).put("runPolicy", "Serial")
        ));

        Map<String, String> runLabels = ImmutableMap.<String, String>builder()
                .putAll(ResourceLabels.forBuild(handle))
                .put(BUILD_CONFIG_LABEL, handle.getBuildBaseName())
                .build();
        ObjectNode runSpec = newBuildSpec(handle, spec, config);
        runSpec.putArray("triggeredBy").addObject().put("message", "Triggered by notebook validation job " + handle.getJobName());
        GenericKubernetesResource build = BuildResources.createOrGet(clusterApi, ResourceKind.OPENSHIFT_BUILD, GenericResources.newResource(
                ResourceKind.OPENSHIFT_BUILD,
                handle.getNamespace(),
                handle.getBuildName(),
                runLabels,
                Collections.singletonMap(BUILD_CONFIG_ANNOTATION, handle.getBuildBaseName()),
                ResourceLabels.ownerReferences(handle.getJobName(), handle.getJobId()),
                runSpec
        ));
        return toBuildInfo(build);
    }

    @Override
    public Optional<BuildInfo> getStatus(BuildHandle handle) {
        return findBuild(handle).map(S2iBuildStrategy::toBuildInfo);
    }

    @Override
    public Optional<String> getImage(BuildHandle handle) {
        Optional<BuildInfo> status = getStatus(handle);
        if (!status.isPresent() || status.get().getPhase() != BuildPhase.Complete) {
            return Optional.empty();
        }
        if (status.get().getImageReference().isPresent()) {
            return status.get().getImageReference();
        }
        return clusterApi.findResource(ResourceKind.OPENSHIFT_IMAGE_STREAM, handle.getNamespace(), handle.getBuildBaseName())
                .flatMap(S2iBuildStrategy::imageStreamReference);
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

    private Optional<GenericKubernetesResource> findBuild(BuildHandle handle) {
        List<GenericKubernetesResource> builds = clusterApi.listResources(
                ResourceKind.OPENSHIFT_BUILD, handle.getNamespace(), ResourceLabels.buildAttemptSelector(handle)
        );
        return builds.isEmpty() ? Optional.empty() : Optional.of(builds.get(0));
    }

    private GenericKubernetesResource newImageStream(BuildHandle handle, Map<String, String> labels) {
        ObjectNode spec = GenericResources.newObjectNode();
        spec.putObject("lookupPolicy").put("local", true);
        return GenericResources.newResource(
                ResourceKind.OPENSHIFT_IMAGE_STREAM,
                handle.getNamespace(),
                handle.getBuildBaseName(),
                labels,
                Collections.emptyMap(),
                ResourceLabels.ownerReferences(handle.getJobName(), handle.getJobId()),
                spec
        );
    }

    /**
     * Spec shared by the BuildConfig and the Build runs created from it.
     */
    private ObjectNode newBuildSpec(BuildHandle handle, ValidationJobSpec jobSpec, BuildConfig config) {
        NotebookSource notebook = jobSpec.getNotebook();
        String baseImage = getNonEmptyOrDefault(config.getBaseImage(), configuration.getDefaultBaseImage());

        ObjectNode spec = GenericResources.newObjectNode();
        spec.put("serviceAccount", jobSpec.getPodConfig().getServiceAccountName());

        ObjectNode source = spec.putObject("source");
        source.put("type", "Git");
        source.putObject("git")
                .put("uri", notebook.getGitUrl())
                .put("ref", notebook.getGitRef());
        if (isNotEmpty(notebook.getCredentialsSecret())) {
            source.putObject("sourceSecret").put("name", notebook.getCredentialsSecret());
        }

        ObjectNode strategy = spec.putObject("strategy");
        if (isNotEmpty(config.getDockerfile())) {
            strategy.put("type", "Docker");
            ObjectNode dockerStrategy = strategy.putObject("dockerStrategy");
            dockerStrategy.put("dockerfilePath", config.getDockerfile());
            dockerStrategy.putObject("from").put("kind", "DockerImage").put("name", baseImage);
        } else {
            strategy.put("type", "Source");
            strategy.putObject("sourceStrategy").putObject("from").put("kind", "DockerImage").put("name", baseImage);
        }

        spec.putObject("output").putObject("to")
                .put("kind", "ImageStreamTag")
                .put("name", handle.getBuildBaseName() + ':' + OUTPUT_TAG);
        return spec;
    }

    static BuildInfo toBuildInfo(GenericKubernetesResource build) {
        JsonNode tree = GenericResources.toTree(build);
        BuildPhase phase = toBuildPhase(GenericResources.text(tree, "/status/phase").orElse(""));
        String message = GenericResources.text(tree, "/status/message")
                .orElse(GenericResources.text(tree, "/status/reason").orElse(""));

        String image = null;
        if (phase == BuildPhase.Complete) {
            image = GenericResources.text(tree, "/status/outputDockerImageReference")
                    .map(reference -> BuildResources.pinDigest(reference, GenericResources.text(tree, "/status/output/to/imageDigest").orElse(null)))
                    .orElse(null);
        }
        return new BuildInfo(
                GenericResources.nameOf(build),
                phase,
                message,
                image,
                GenericResources.time(tree, "/status/startTimestamp"),
                GenericResources.time(tree, "/status/completionTimestamp")
        );
    }

    static BuildPhase toBuildPhase(String phase) {
        switch (phase) {
            case "":
            case "New":
            case "Pending":
                return BuildPhase.Pending;
            case "Running":
                return BuildPhase.Running;
            case "Complete":
                return BuildPhase.Complete;
            case "Failed":
            case "Error":
                return BuildPhase.Failed;
            case "Cancelled":
                return BuildPhase.Cancelled;
            default:
                return BuildPhase.Unknown;
        }
    }

    private static Optional<String> imageStreamReference(GenericKubernetesResource imageStream) {
        JsonNode tree = GenericResources.toTree(imageStream);
        for (JsonNode tag : tree.at("/status/tags")) {
            if (OUTPUT_TAG.equals(tag.path("tag").asText()) && tag.path("items").size() > 0) {
                return GenericResources.text(tag, "/items/0/dockerImageReference");
            }
        }
        return GenericResources.text(tree, "/status/dockerImageRepository").map(repository -> repository + ':' + OUTPUT_TAG);
    }
}
