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

import java.util.regex.Pattern;

import io.mlops.validator.api.model.BuildConfig;
import io.mlops.validator.api.service.ValidatorException;

import static io.mlops.validator.common.util.StringExt.isNotEmpty;

/**
 * Checks shared by all strategies. Paths end up inside generated shell scripts, so they are restricted to a safe
 * character set.
 */
public final class BuildConfigChecks {

    private static final Pattern RELATIVE_PATH = Pattern.compile("[A-Za-z0-9._/-]+");
    private static final Pattern IMAGE_REFERENCE = Pattern.compile("[A-Za-z0-9._/:@-]+");

    private BuildConfigChecks() {
    }

    public static void checkCommon(BuildConfig config) {
        if (isNotEmpty(config.getDockerfile())) {
            checkRelativePath("buildConfig.dockerfile", config.getDockerfile());
        }
        checkRelativePath("buildConfig.requirementsFile", config.getRequirementsFile());
        if (isNotEmpty(config.getBaseImage()) && !IMAGE_REFERENCE.matcher(config.getBaseImage()).matches()) {
            throw ValidatorException.configurationInvalid("buildConfig.baseImage is not a valid image reference: " + config.getBaseImage());
        }
    }

    static void checkRelativePath(String field, String path) {
        if (!RELATIVE_PATH.matcher(path).matches()) {
            throw ValidatorException.configurationInvalid(field + " contains unsupported characters: " + path);
        }
        if (path.startsWith("/")) {
            throw ValidatorException.configurationInvalid(field + " must be relative to the repository root: " + path);
        }
        for (String segment : path.split("/")) {
            if (segment.equals("..")) {
                throw ValidatorException.configurationInvalid(field + " must not leave the repository: " + path);
            }
        }
    }
}
