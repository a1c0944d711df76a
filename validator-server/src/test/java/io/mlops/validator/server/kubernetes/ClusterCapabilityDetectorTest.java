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

import io.mlops.validator.api.build.BuildCapability;
import io.mlops.validator.api.build.ClusterCapabilities;
import io.mlops.validator.api.service.ValidatorException;
import io.mlops.validator.api.service.ValidatorException.ErrorCategory;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ClusterCapabilityDetectorTest {

    private final StubClusterApiFacade clusterApi = new StubClusterApiFacade();
    private final ClusterCapabilityDetector detector = new ClusterCapabilityDetector(clusterApi);

    @Test
    public void testVanillaCluster() {
        ClusterCapabilities capabilities = detector.detect();

        assertThat(capabilities.getBuildCapabilities()).isEmpty();
        assertThat(capabilities.getServingPlatforms()).isEmpty();
    }

    @Test
    public void testOpenShiftWithServing() {
        clusterApi.withAvailableKinds(
                ResourceKind.OPENSHIFT_BUILD_CONFIG,
                ResourceKind.TEKTON_PIPELINE,
                ResourceKind.KSERVE_INFERENCE_SERVICE,
                ResourceKind.RAY_SERVICE
        );

        ClusterCapabilities capabilities = detector.detect();

        assertThat(capabilities.getBuildCapabilities()).containsExactlyInAnyOrder(BuildCapability.OPENSHIFT_BUILDS, BuildCapability.TEKTON_PIPELINES);
        assertThat(capabilities.getServingPlatforms()).containsExactly("kserve", "ray");
        assertThat(capabilities.isServingPlatformAvailable("KServe")).isTrue();
        assertThat(capabilities.isServingPlatformAvailable("openshift-ai")).isTrue();
        assertThat(capabilities.isServingPlatformAvailable("ray-serve")).isTrue();
        assertThat(capabilities.isServingPlatformAvailable("seldon")).isFalse();
        assertThat(capabilities.isServingPlatformAvailable("vllm")).isFalse();
    }

    @Test
    public void testDiscoveryFailureIsTransient() {
        clusterApi.failDiscovery(new KubeApiException("connection refused", KubeApiException.ErrorCode.UNAVAILABLE));

        assertThatThrownBy(detector::detect)
                .isInstanceOf(ValidatorException.class)
                .hasMessageContaining("connection refused")
                .matches(e -> ((ValidatorException) e).getCategory() == ErrorCategory.TransientInfra);
    }
}
