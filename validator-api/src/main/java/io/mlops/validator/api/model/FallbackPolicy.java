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

package io.mlops.validator.api.model;

import java.util.Locale;

/**
 * What a generated image build does when the source tree has no dependency manifest.
 */
public enum FallbackPolicy {

    /**
     * Log a warning in the build output and skip the dependency install.
     */
    Warn,

    /**
     * Fail the build step.
     */
    Fail,

    /**
     * Skip the dependency install and proceed.
     */
    Auto;

    public static FallbackPolicy parse(String value) {
        if (value == null || value.isEmpty()) {
            return Auto;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "warn":
                return Warn;
            case "fail":
                return Fail;
            case "auto":
                return Auto;
        }
        throw new IllegalArgumentException("Unknown fallback policy: " + value);
    }
}
