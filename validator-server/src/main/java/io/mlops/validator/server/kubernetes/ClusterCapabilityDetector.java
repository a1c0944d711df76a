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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.mlops.validator.api.build.BuildCapability;
import io.mlops.validator.api.build.ClusterCapabilities;
import io.mlops.validator.api.service.ValidatorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up the optional build subsystems and model serving platforms in the cluster API discovery. Nothing is
 * cached, so a subsystem installed after the controller started is found on the next call.
 */
@Singleton
public class ClusterCapabilityDetector {

    private static final Logger logger = LoggerFactory.getLogger(ClusterCapabilityDetector.class);

    private static final Map<BuildCapability, ResourceKind> BUILD_KINDS = new LinkedHashMap<>();
    private static final Map<String, ResourceKind> SERVING_KINDS = new LinkedHashMap<>();

    static {
        BUILD_KINDS.put(BuildCapability.OPENSHIFT_BUILDS, ResourceKind.OPENSHIFT_BUILD_CONFIG);
        BUILD_KINDS.put(BuildCapability.TEKTON_PIPELINES, ResourceKind.TEKTON_PIPELINE);

        SERVING_KINDS.put("kserve", ResourceKind.KSERVE_INFERENCE_SERVICE);
        SERVING_KINDS.put("ray", ResourceKind.RAY_SERVICE);
        SERVING_KINDS.put("seldon", ResourceKind.SELDON_DEPLOYMENT);
        SERVING_KINDS.put("bentoml", ResourceKind.BENTOML_BENTO);
    }

    private final ClusterApiFacade clusterApi;

    @Inject
    public ClusterCapabilityDetector(ClusterApiFacade clusterApi) {
        this.clusterApi = clusterApi;
    }

    public ClusterCapabilities detect() {
        Set<BuildCapability> buildCapabilities = EnumSet.noneOf(BuildCapability.class);
        Set<String> servingPlatforms = new LinkedHashSet<>();
        try {
            BUILD_KINDS.forEach((capability, kind) -> {
                if (clusterApi.isResourceKindAvailable(kind)) {
                    buildCapabilities.add(capability);
                }
            });
            SERVING_KINDS.forEach((platform, kind) -> {
                if (clusterApi.isResourceKindAvailable(kind)) {
                    servingPlatforms.add(platform);
                }
            });
        } catch (KubeApiException e) {
            throw ValidatorException.transientInfra("Cluster API discovery failed: " + e.getMessage(), e);
        }
        ClusterCapabilities capabilities = new ClusterCapabilities(buildCapabilities, servingPlatforms);
        logger.debug("Detected cluster capabilities: {}", capabilities);
        return capabilities;
    }
}
