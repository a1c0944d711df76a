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

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "notebook.validator.build")
public interface BuildStrategyConfiguration {

    /**
     * @return the image the notebook image is built from, when the build configuration does not name one
     */
    @DefaultValue("quay.io/jupyter/minimal-notebook:latest")
    String getDefaultBaseImage();

    /**
     * @return the registry pipeline builds push to, unless overridden by the 'registry' strategy option
     */
    @DefaultValue("image-registry.openshift-image-registry.svc:5000")
    String getDefaultRegistry();

    /**
     * @return the image running the git clone init container of validation pods
     */
    @DefaultValue("alpine/git:latest")
    String getGitCloneImage();

    /**
     * @return the image running the Dockerfile generation step of pipeline builds
     */
    @DefaultValue("registry.access.redhat.com/ubi9/ubi-minimal:latest")
    String getDockerfileGeneratorImage();

    /**
     * @return the size of the volume shared between the pipeline tasks
     */
    @DefaultValue("1Gi")
    String getPipelineWorkspaceSize();
}
