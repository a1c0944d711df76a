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

package io.mlops.validator.server.build;

import io.mlops.validator.api.model.BuildConfig;
import io.mlops.validator.api.model.ReasonCode;
import io.mlops.validator.api.service.ValidatorException;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class BuildConfigChecksTest {

    @Test
    public void testValidConfig() {
        BuildConfig config = BuildConfig.newBuilder()
                .withEnabled(true)
                .withDockerfile("docker/Dockerfile")
                .withRequirementsFile("env/requirements.txt")
                .withBaseImage("quay.io/jupyter/minimal-notebook@sha256:abc123")
                .build();
        assertThatCode(() -> BuildConfigChecks.checkCommon(config)).doesNotThrowAnyException();
    }

    @Test
    public void testAbsolutePathIsRejected() {
        assertInvalid(BuildConfig.newBuilder().withEnabled(true).withRequirementsFile("/etc/passwd").build(), "must be relative");
    }

    @Test
    public void testParentDirectoryIsRejected() {
        assertInvalid(BuildConfig.newBuilder().withEnabled(true).withDockerfile("../Dockerfile").build(), "must not leave the repository");
    }

    @Test
    public void testShellCharactersAreRejected() {
        assertInvalid(BuildConfig.newBuilder().withEnabled(true).withRequirementsFile("req.txt; rm -rf /").build(), "unsupported characters");
        assertInvalid(BuildConfig.newBuilder().withEnabled(true).withBaseImage("ubi9 $(id)").build(), "not a valid image reference");
    }

    private static void assertInvalid(BuildConfig config, String expectedMessage) {
        assertThatThrownBy(() -> BuildConfigChecks.checkCommon(config))
                .isInstanceOf(ValidatorException.class)
                .hasMessageContaining(expectedMessage)
                .matches(e -> ((ValidatorException) e).getReasonCode() == ReasonCode.ConfigurationInvalid);
    }
}
