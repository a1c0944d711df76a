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

package io.mlops.validator.api.service;

import java.util.List;

import io.mlops.validator.api.model.ReasonCode;

import static java.lang.String.format;

public class ValidatorException extends RuntimeException {

    /**
     * Error categories driving the retry decision.
     */
    public enum ErrorCategory {
        TransientInfra,
        RetriableExecutionFailure,
        ResourceExhaustion,
        ConfigurationError,
        CapabilityUnavailable,
        TerminalExecutionFailure;

        public boolean isTerminal() {
            return this == ConfigurationError || this == CapabilityUnavailable || this == TerminalExecutionFailure;
        }
    }

    private final ErrorCategory category;
    private final ReasonCode reasonCode;

    private ValidatorException(ErrorCategory category, ReasonCode reasonCode, String message) {
        this(category, reasonCode, message, null);
    }

    private ValidatorException(ErrorCategory category, ReasonCode reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.reasonCode = reasonCode;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public ReasonCode getReasonCode() {
        return reasonCode;
    }

    public static boolean hasCategory(Throwable error, ErrorCategory category) {
        return (error instanceof ValidatorException) && ((ValidatorException) error).getCategory() == category;
    }

    public static ValidatorException configurationInvalid(String message) {
        return new ValidatorException(ErrorCategory.ConfigurationError, ReasonCode.ConfigurationInvalid,
                format("Invalid job configuration: %s. Fix the job spec and re-apply it", message));
    }

    public static ValidatorException strategyNotFound(String name, List<String> knownStrategies) {
        return new ValidatorException(ErrorCategory.ConfigurationError, ReasonCode.StrategyNotFound,
                format("Build strategy '%s' is not registered (known strategies: %s). Set buildConfig.strategy to one of them or to 'auto'",
                        name, knownStrategies));
    }

    public static ValidatorException strategyUnavailable(String name, String capability) {
        return new ValidatorException(ErrorCategory.CapabilityUnavailable, ReasonCode.StrategyUnavailable,
                format("Build strategy '%s' is not available in this cluster (missing %s). Install it or choose another strategy",
                        name, capability));
    }

    public static ValidatorException noStrategyAvailable(List<String> checksAttempted) {
        return new ValidatorException(ErrorCategory.CapabilityUnavailable, ReasonCode.NoStrategyAvailable,
                format("No build strategy available; capability checks attempted: %s. Install a build subsystem or disable the build",
                        checksAttempted));
    }

    public static ValidatorException buildFailed(String buildName, String detail) {
        return new ValidatorException(ErrorCategory.RetriableExecutionFailure, ReasonCode.BuildFailed,
                format("Image build %s failed: %s. Check the build logs", buildName, detail));
    }

    public static ValidatorException buildTimeout(String buildName, String timeout) {
        return new ValidatorException(ErrorCategory.TerminalExecutionFailure, ReasonCode.BuildTimeout,
                format("Image build %s did not complete within %s. Increase buildConfig.timeout or simplify the build", buildName, timeout));
    }

    public static ValidatorException buildImageMissing(String jobName) {
        return new ValidatorException(ErrorCategory.RetriableExecutionFailure, ReasonCode.BuildImageMissing,
                format("Build of job %s completed without an image reference; rebuilding", jobName));
    }

    public static ValidatorException jobTimeout(String jobName, String timeout) {
        return new ValidatorException(ErrorCategory.TerminalExecutionFailure, ReasonCode.JobTimeout,
                format("Job %s did not complete within %s. Increase spec.timeout", jobName, timeout));
    }

    public static ValidatorException transientInfra(String message, Throwable cause) {
        return new ValidatorException(ErrorCategory.TransientInfra, ReasonCode.TransientInfraError, message, cause);
    }

    /**
     * Validation pod failure, as classified by the pod failure analysis.
     */
    public static ValidatorException podFailure(ErrorCategory category, ReasonCode reasonCode, String message) {
        return new ValidatorException(category, reasonCode, message);
    }

    public static ValidatorException notebookExecutionFailed(String message) {
        return new ValidatorException(ErrorCategory.TerminalExecutionFailure, ReasonCode.NotebookExecutionFailed, message);
    }
}
