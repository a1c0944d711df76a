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

import io.mlops.validator.api.model.BuildConfig;
import io.mlops.validator.api.model.FallbackPolicy;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class DockerfileGeneratorTest {

    private static final String BASE_IMAGE = "quay.io/jupyter/minimal-notebook:2024-01-15";

    private final DockerfileGenerator generator = new DockerfileGenerator();

    @Test
    public void testDockerfileWithRequirements() {
        assertThat(generator.generateDockerfile(BASE_IMAGE, "requirements.txt")).isEqualTo(
                "FROM " + BASE_IMAGE + "\n"
                        + "COPY requirements.txt /tmp/requirements.txt\n"
                        + "RUN pip install --no-cache-dir -r /tmp/requirements.txt\n"
                        + "COPY . /opt/app-root/src/\n"
                        + "WORKDIR /opt/app-root/src\n"
        );
    }

    @Test
    public void testDockerfileWithoutRequirements() {
        String dockerfile = generator.generateDockerfile(BASE_IMAGE, null);
        assertThat(dockerfile).doesNotContain("pip install");
        assertThat(dockerfile).startsWith("FROM " + BASE_IMAGE);
    }

    @Test
    public void testScriptPrefersRepositoryBuildFiles() {
        String script = generator.generateScript(BuildConfig.newBuilder().withEnabled(true).build(), BASE_IMAGE);

        assertThat(script).startsWith("#!/bin/sh\nset -e\n");
        assertThat(script).contains("if [ -f Dockerfile ]; then");
        assertThat(script).contains("cp Containerfile Dockerfile");
        assertThat(script.indexOf("Containerfile")).isLessThan(script.indexOf("Installing dependencies"));
        assertThat(script).endsWith("cat Dockerfile\n");
    }

    @Test
    public void testScriptUsesCustomDockerfileFirst() {
        BuildConfig config = BuildConfig.newBuilder().withEnabled(true).withDockerfile("docker/Dockerfile.gpu").build();
        String script = generator.generateScript(config, BASE_IMAGE);

        assertThat(script).contains("if [ -f \"docker/Dockerfile.gpu\" ]; then");
        assertThat(script.indexOf("docker/Dockerfile.gpu")).isLessThan(script.indexOf("Using Dockerfile from repository"));
    }

    @Test
    public void testFailPolicyStopsWithoutManifest() {
        BuildConfig config = BuildConfig.newBuilder().withEnabled(true).withFallbackPolicy(FallbackPolicy.Fail).build();
        String script = generator.generateScript(config, BASE_IMAGE);

        assertThat(script).contains("requirements.txt not found and fallbackPolicy is 'fail'");
        assertThat(script).contains("  exit 1\n");
        // Only the branch with the manifest writes a build file.
        assertThat(script.split("cat > Dockerfile", -1)).hasSize(2);
    }

    @Test
    public void testWarnPolicyBuildsWithoutDependencies() {
        BuildConfig config = BuildConfig.newBuilder()
                .withEnabled(true)
                .withFallbackPolicy(FallbackPolicy.Warn)
                .withRequirementsFile("env/requirements-dev.txt")
                .build();
        String script = generator.generateScript(config, BASE_IMAGE);

        assertThat(script).contains("if [ -f \"env/requirements-dev.txt\" ]; then");
        assertThat(script).contains("WARNING: env/requirements-dev.txt not found, skipping dependency install");
        assertThat(script.split("cat > Dockerfile", -1)).hasSize(3);
        assertThat(script).doesNotContain("exit 1");
    }
}
