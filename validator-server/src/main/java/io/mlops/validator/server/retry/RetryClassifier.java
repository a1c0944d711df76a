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

package io.mlops.validator.server.retry;

import java.time.Duration;

import io.mlops.validator.api.model.ReasonCode;
import io.mlops.validator.api.service.ValidatorException;
import io.mlops.validator.api.service.ValidatorException.ErrorCategory;
import io.mlops.validator.common.util.SanitizerExt;
import io.mlops.validator.common.util.StringExt;
import io.mlops.validator.server.kubernetes.KubeApiException;

import static java.lang.String.format;

/**
 * Maps a handler error and the current retry count to a retry decision. The classifier has no state and no side
 * effects.
 */
public class RetryClassifier {

    /**
     * Backend error text appended to user facing messages is cut to this length.
     */
    static final int MAX_DETAIL_LENGTH = 1024;

    private final BackoffSchedule backoffSchedule;

    public RetryClassifier() {
        this(BackoffSchedule.defaultSchedule());
    }

    public RetryClassifier(BackoffSchedule backoffSchedule) {
        this.backoffSchedule = backoffSchedule;
    }

    public RetryDecision classify(Throwable error, int retryCount, int maxRetries) {
        ErrorCategory category = categoryOf(error);
        ReasonCode reasonCode = reasonCodeOf(error, category);
        String message = messageOf(error);

        switch (category) {
            case TransientInfra: {
                int next = Math.min(retryCount + 1, maxRetries);
                return new RetryDecision(RetryClassification.Transient, next, backoffSchedule.delayFor(next), reasonCode, message);
            }
            case RetriableExecutionFailure:
            case ResourceExhaustion: {
                // Transient errors may already have consumed the budget, so the count is capped as well.
                int next = Math.min(retryCount + 1, maxRetries);
                if (next >= maxRetries) {
                    return new RetryDecision(
                            RetryClassification.Terminal,
                            next,
                            Duration.ZERO,
                            ReasonCode.RetriesExhausted,
                            format("Giving up after %d retries. Last error: %s", next, message)
                    );
                }
                return new RetryDecision(RetryClassification.Retriable, next, backoffSchedule.delayFor(next), reasonCode, message);
            }
            case ConfigurationError:
            case CapabilityUnavailable:
            case TerminalExecutionFailure:
            default:
                return new RetryDecision(RetryClassification.Terminal, retryCount, Duration.ZERO, reasonCode, message);
        }
    }

    /**
     * Cluster API errors are infrastructure failures, unless the request itself was rejected.
     */
    static ErrorCategory categoryOf(Throwable error) {
        if (error instanceof ValidatorException) {
            return ((ValidatorException) error).getCategory();
        }
        if (error instanceof KubeApiException) {
            return ((KubeApiException) error).isClientError() ? ErrorCategory.ConfigurationError : ErrorCategory.TransientInfra;
        }
        return ErrorCategory.TransientInfra;
    }

    private static ReasonCode reasonCodeOf(Throwable error, ErrorCategory category) {
        if (error instanceof ValidatorException) {
            return ((ValidatorException) error).getReasonCode();
        }
        return category == ErrorCategory.ConfigurationError ? ReasonCode.ConfigurationInvalid : ReasonCode.TransientInfraError;
    }

    private static String messageOf(Throwable error) {
        if (error instanceof ValidatorException) {
            return truncate(error.getMessage());
        }
        if (error instanceof KubeApiException) {
            if (((KubeApiException) error).isClientError()) {
                return "Cluster API rejected a request; check the job spec and the controller RBAC permissions: "
                        + truncate(error.getMessage());
            }
            return "Cluster API unavailable; will retry: " + truncate(error.getMessage());
        }
        return "Unexpected error; will retry: " + truncate(error.getMessage());
    }

    private static String truncate(String detail) {
        return StringExt.truncate(SanitizerExt.sanitizeText(detail), MAX_DETAIL_LENGTH, "...");
    }
}
