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

import java.util.Objects;

/**
 * Outcome of the serving platform check made before the validation pod starts. A missing platform does not fail the
 * job.
 */
public class ModelValidationResult {

    private final String platform;
    private final boolean platformDetected;
    private final String message;

    public ModelValidationResult(String platform, boolean platformDetected, String message) {
        this.platform = platform == null ? "" : platform;
        this.platformDetected = platformDetected;
        this.message = message == null ? "" : message;
    }

    public String getPlatform() {
        return platform;
    }

    public boolean isPlatformDetected() {
        return platformDetected;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ModelValidationResult that = (ModelValidationResult) o;
        return platformDetected == that.platformDetected &&
                Objects.equals(platform, that.platform) &&
                Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(platform, platformDetected, message);
    }

    @Override
    public String toString() {
        return "ModelValidationResult{" +
                "platform='" + platform + '\'' +
                ", platformDetected=" + platformDetected +
                ", message='" + message + '\'' +
                '}';
    }
}
