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

import io.mlops.validator.api.model.ReasonCode;
import io.mlops.validator.api.service.ValidatorException.ErrorCategory;
import org.junit.Test;

import static io.mlops.validator.server.execution.PodStatusSamples.podWithStatus;
import static org.assertj.core.api.Assertions.assertThat;

public class PodFailureAnalyzerTest {

    private final PodFailureAnalyzer analyzer = new PodFailureAnalyzer();

    @Test
    public void testImagePullFailureIsTransient() {
        PodFailureAnalysis analysis = analyzer.analyzePending(podWithStatus(
                PodStatusSamples.waiting(ValidationPodFactory.VALIDATOR_CONTAINER, "ImagePullBackOff", "Back-off pulling image")
        )).get();

        assertThat(analysis.getCategory()).isEqualTo(ErrorCategory.TransientInfra);
        assertThat(analysis.getReasonCode()).isEqualTo(ReasonCode.ImagePullFailed);
        assertThat(analysis.getFailedContainer()).isEqualTo(ValidationPodFactory.VALIDATOR_CONTAINER);
        assertThat(analysis.isInitContainer()).isFalse();
    }

    @Test
    public void testSccViolationInInitContainer() {
        PodFailureAnalysis analysis = analyzer.analyzePending(podWithStatus(
                PodStatusSamples.initWaiting("RunContainerError", "container has runAsNonRoot and image will run as root")
        )).get();

        assertThat(analysis.getCategory()).isEqualTo(ErrorCategory.ConfigurationError);
        assertThat(analysis.isSccViolation()).isTrue();
        assertThat(analysis.isInitContainer()).isTrue();
        assertThat(analysis.getMessage())
                .startsWith("Validation pod failed (init container git-clone)")
                .contains("Enable the image build");
    }

    @Test
    public void testMissingSecretIsConfigurationError() {
        PodFailureAnalysis analysis = analyzer.analyzePending(podWithStatus(
                PodStatusSamples.waiting(ValidationPodFactory.VALIDATOR_CONTAINER, "CreateContainerConfigError", "secret \"aws\" not found")
        )).get();

        assertThat(analysis.getCategory()).isEqualTo(ErrorCategory.ConfigurationError);
        assertThat(analysis.getReasonCode()).isEqualTo(ReasonCode.ConfigurationInvalid);
        assertThat(analysis.getDetail()).contains("aws");
    }

    @Test
    public void testPendingPodWithoutProblems() {
        assertThat(analyzer.analyzePending(podWithStatus(
                PodStatusSamples.waiting(ValidationPodFactory.VALIDATOR_CONTAINER, "ContainerCreating", null)
        ))).isEmpty();
        assertThat(analyzer.analyzePending(podWithStatus(PodStatusSamples.running()))).isEmpty();
    }

    @Test
    public void testOutOfMemory() {
        PodFailureAnalysis analysis = analyzer.analyze(podWithStatus(
                PodStatusSamples.failed(ValidationPodFactory.VALIDATOR_CONTAINER, 137, "OOMKilled")
        ));

        assertThat(analysis.getCategory()).isEqualTo(ErrorCategory.ResourceExhaustion);
        assertThat(analysis.getReasonCode()).isEqualTo(ReasonCode.ResourceExhausted);
        assertThat(analysis.getSuggestedAction()).contains("memory limit");
    }

    @Test
    public void testInitContainerExitCode() {
        PodFailureAnalysis analysis = analyzer.analyze(podWithStatus(PodStatusSamples.initContainerFailed(128)));

        assertThat(analysis.getCategory()).isEqualTo(ErrorCategory.RetriableExecutionFailure);
        assertThat(analysis.getReasonCode()).isEqualTo(ReasonCode.InitContainerFailed);
        assertThat(analysis.getSuggestedAction()).contains("exit code 128");
    }

    @Test
    public void testMainContainerExitCode() {
        PodFailureAnalysis analysis = analyzer.analyze(podWithStatus(
                PodStatusSamples.failed(ValidationPodFactory.VALIDATOR_CONTAINER, 1, "Error")
        ));

        assertThat(analysis.getReasonCode()).isEqualTo(ReasonCode.PodFailed);
        assertThat(analysis.getSuggestedAction()).contains("reason Error and exit code 1");
    }

    @Test
    public void testUnschedulablePod() {
        PodFailureAnalysis analysis = analyzer.analyze(podWithStatus(PodStatusSamples.unschedulable()));

        assertThat(analysis.getCategory()).isEqualTo(ErrorCategory.TransientInfra);
        assertThat(analysis.getDetail()).contains("Insufficient memory");
    }

    @Test
    public void testUnknownFailure() {
        PodFailureAnalysis analysis = analyzer.analyze(podWithStatus(PodStatusSamples.running()));

        assertThat(analysis.getCategory()).isEqualTo(ErrorCategory.RetriableExecutionFailure);
        assertThat(analysis.getReasonCode()).isEqualTo(ReasonCode.PodFailed);
    }

    @Test
    public void testSccDetection() {
        assertThat(PodFailureAnalyzer.isSccViolation("unable to validate against any security context constraint")).isTrue();
        assertThat(PodFailureAnalyzer.isSccViolation("SCC restricted-v2 denied")).isTrue();
        assertThat(PodFailureAnalyzer.isSccViolation("exec format error")).isFalse();
        assertThat(PodFailureAnalyzer.isSccViolation(null)).isFalse();
    }
}
