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

package io.mlops.validator.server.execution;

import java.util.Objects;

import io.mlops.validator.api.model.ReasonCode;
import io.mlops.validator.api.service.ValidatorException;
import io.mlops.validator.api.service.ValidatorException.ErrorCategory;

/**
 * Outcome of a validation pod failure analysis.
 */
public class PodFailureAnalysis {

    private final ErrorCategory category;
    private final ReasonCode reasonCode;
    private final String failedContainer;
    private final boolean initContainer;
    private final boolean sccViolation;
    private final String detail;
    private final String suggestedAction;

    public PodFailureAnalysis(ErrorCategory category,
                              ReasonCode reasonCode,
                              String failedContainer,
                              boolean initContainer,
                              boolean sccViolation,
                              String detail,
                              String suggestedAction) {
        this.category = category;
        this.reasonCode = reasonCode;
        this.failedContainer = failedContainer;
        this.initContainer = initContainer;
        this.sccViolation = sccViolation;
        this.detail = detail == null ? "" : detail;
        this.suggestedAction = suggestedAction;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public ReasonCode getReasonCode() {
        return reasonCode;
    }

    /**
     * Name of the failed container, or null if the failure is not attributed to a container.
     */
    public String getFailedContainer() {
        return failedContainer;
    }

    public boolean isInitContainer() {
        return initContainer;
    }

    public boolean isSccViolation() {
        return sccViolation;
    }

    public String getDetail() {
        return detail;
    }

    public String getSuggestedAction() {
        return suggestedAction;
    }

    public String getMessage() {
        StringBuilder sb = new StringBuilder("Validation pod failed");
        if (failedContainer != null) {
            sb.append(" (").append(initContainer ? "init container " : "container ").append(failedContainer).append(')');
        }
        sb.append(": ").append(suggestedAction);
        if (!detail.isEmpty()) {
            sb.append(" Detail: ").append(detail);
        }
        return sb.toString();
    }

    public ValidatorException toException() {
        return ValidatorException.podFailure(category, reasonCode, getMessage());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PodFailureAnalysis that = (PodFailureAnalysis) o;
        return initContainer == that.initContainer &&
                sccViolation == that.sccViolation &&
                category == that.category &&
                reasonCode == that.reasonCode &&
                Objects.equals(failedContainer, that.failedContainer) &&
                Objects.equals(detail, that.detail) &&
                Objects.equals(suggestedAction, that.suggestedAction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, reasonCode, failedContainer, initContainer, sccViolation, detail, suggestedAction);
    }

    @Override
    public String toString() {
        return "PodFailureAnalysis{" +
                "category=" + category +
                ", reasonCode=" + reasonCode +
                ", failedContainer='" + failedContainer + '\'' +
                ", initContainer=" + initContainer +
                ", sccViolation=" + sccViolation +
                ", detail='" + detail + '\'' +
                ", suggestedAction='" + suggestedAction + '\'' +
                '}';
    }
}
