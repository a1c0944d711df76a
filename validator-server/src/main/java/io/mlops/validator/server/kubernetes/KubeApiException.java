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

package io.mlops.validator.server.kubernetes;

import io.fabric8.kubernetes.api.model.Status;
import io.fabric8.kubernetes.client.KubernetesClientException;

public class KubeApiException extends RuntimeException {

    private static final String ALREADY_EXISTS = "AlreadyExists";

    public enum ErrorCode {
        CONFLICT_ALREADY_EXISTS,
        CONFLICT,
        FORBIDDEN,
        INTERNAL,
        INVALID,
        NOT_FOUND,
        UNAVAILABLE,
    }

    private final ErrorCode errorCode;

    public KubeApiException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = cause instanceof KubernetesClientException ? toErrorCode((KubernetesClientException) cause) : ErrorCode.INTERNAL;
    }

    public KubeApiException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public KubeApiException(KubernetesClientException cause) {
        this(String.format("%s: httpStatus=%s", cause.getMessage(), cause.getCode()), cause);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Returns true if repeating the request with the same input cannot succeed.
     */
    public boolean isClientError() {
        return errorCode == ErrorCode.INVALID || errorCode == ErrorCode.FORBIDDEN;
    }

    private static ErrorCode toErrorCode(KubernetesClientException e) {
        int code = e.getCode();
        if (code == 404) {
            return ErrorCode.NOT_FOUND;
        }
        if (code == 409) {
            Status status = e.getStatus();
            if (status != null && ALREADY_EXISTS.equals(status.getReason())) {
                return ErrorCode.CONFLICT_ALREADY_EXISTS;
            }
            return ErrorCode.CONFLICT;
        }
        if (code == 400 || code == 422) {
            return ErrorCode.INVALID;
        }
        if (code == 401 || code == 403) {
            return ErrorCode.FORBIDDEN;
        }
        // Code 0 means no HTTP response (connection refused, timeout).
        if (code == 0 || code == 429 || code >= 500) {
            return ErrorCode.UNAVAILABLE;
        }
        return ErrorCode.INTERNAL;
    }
}
