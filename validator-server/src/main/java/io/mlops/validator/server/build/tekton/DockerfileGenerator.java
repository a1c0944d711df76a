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

import static io.mlops.validator.common.util.StringExt.isNotEmpty;

/**
 * Produces the shell script of the 'generate-dockerfile' pipeline step. The script keeps a build file found in the
 * repository, and otherwise writes one that installs the dependency manifest on top of the base image.
 */
public class DockerfileGenerator {

    public static final String APP_ROOT = "/opt/app-root/src";

    private static final String HEREDOC_MARKER = "VALIDATOR_DOCKERFILE";

    /**
     * Build file content. The dependency install is omitted if the requirements file is null.
     */
    public String generateDockerfile(String baseImage, String requirementsFile) {
        StringBuilder sb = new StringBuilder();
        sb.append("FROM ").append(baseImage).append('\n');
        if (requirementsFile != null) {
            sb.append("COPY ").append(requirementsFile).append(" /tmp/requirements.txt\n");
            sb.append("RUN pip install --no-cache-dir -r /tmp/requirements.txt\n");
        }
        sb.append("COPY . ").append(APP_ROOT).append("/\n");
        sb.append("WORKDIR ").append(APP_ROOT).append('\n');
        return sb.toString();
    }

    public String generateScript(BuildConfig config, String baseImage) {
        String requirementsFile = config.getRequirementsFile();
        StringBuilder sb = new StringBuilder();
        line(sb, "#!/bin/sh");
        line(sb, "set -e");
        line(sb, "cd \"$(workspaces.source.path)\"");

        if (isNotEmpty(config.getDockerfile())) {
            String dockerfile = config.getDockerfile();
            line(sb, "if [ -f \"" + dockerfile + "\" ]; then");
            line(sb, "  echo \"Using build file " + dockerfile + "\"");
            line(sb, "  if [ \"" + dockerfile + "\" != \"Dockerfile\" ]; then cp \"" + dockerfile + "\" Dockerfile; fi");
            line(sb, "  exit 0");
            line(sb, "fi");
            line(sb, "echo \"WARNING: build file " + dockerfile + " not found, generating one\"");
        }

        line(sb, "if [ -f Dockerfile ]; then");
        line(sb, "  echo \"Using Dockerfile from repository\"");
        line(sb, "  exit 0");
        line(sb, "fi");
        line(sb, "if [ -f Containerfile ]; then");
        line(sb, "  echo \"Using Containerfile from repository\"");
        line(sb, "  cp Containerfile Dockerfile");
        line(sb, "  exit 0");
        line(sb, "fi");

        line(sb, "if [ -f \"" + requirementsFile + "\" ]; then");
        line(sb, "  echo \"Installing dependencies from " + requirementsFile + "\"");
        writeDockerfile(sb, generateDockerfile(baseImage, requirementsFile));
        line(sb, "else");
        if (appendMissingManifestBranch(sb, config.getFallbackPolicy(), requirementsFile)) {
            writeDockerfile(sb, generateDockerfile(baseImage, null));
        }
        line(sb, "fi");
        line(sb, "cat Dockerfile");
        return sb.toString();
    }

    /**
     * @return true if the build proceeds without the dependency install
     */
    private boolean appendMissingManifestBranch(StringBuilder sb, FallbackPolicy policy, String requirementsFile) {
        switch (policy) {
            case Fail:
                line(sb, "  echo \"ERROR: " + requirementsFile + " not found and fallbackPolicy is 'fail'. "
                        + "Add the file to the repository or set buildConfig.fallbackPolicy to 'warn'\"");
                line(sb, "  exit 1");
                return false;
            case Warn:
                line(sb, "  echo \"WARNING: " + requirementsFile + " not found, skipping dependency install\"");
                return true;
            case Auto:
            default:
                line(sb, "  echo \"No " + requirementsFile + " found, building without extra dependencies\"");
                return true;
        }
    }

    private void writeDockerfile(StringBuilder sb, String content) {
        line(sb, "  cat > Dockerfile <<'" + HEREDOC_MARKER + "'");
        sb.append(content);
        line(sb, HEREDOC_MARKER);
    }

    private static void line(StringBuilder sb, String text) {
        sb.append(text).append('\n');
    }
}
