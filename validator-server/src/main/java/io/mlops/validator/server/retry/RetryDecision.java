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
import java.util.Objects;

import io.mlops.validator.api.model.ReasonCode;

public class RetryDecision {

    private final RetryClassification classification;
    private final int nextRetryCount;
    private final Duration delay;
    private final ReasonCode reasonCode;
    private final String message;

    public RetryDecision(RetryClassification classification, int nextRetryCount, Duration delay, ReasonCode reasonCode, String message) {
        this.classification = classification;
        this.nextRetryCount = nextRetryCount;
        this.delay = delay;
        this.reasonCode = reasonCode;
        this.message = message;
    }

    public RetryClassification getClassification() {
        return classification;
    }

    public boolean isTerminal() {
        return classification == RetryClassification.Terminal;
    }

    /**
     * Retry count to store in the job status.
     */
    public int getNextRetryCount() {
        return nextRetryCount;
    }

    /**
     * Requeue delay. {@link Duration#ZERO} for terminal decisions.
     */
    public Duration getDelay() {
        return delay;
    }

    public ReasonCode getReasonCode() {
        return reasonCode;
    }

    /**
     * User facing description of the failure and of the corrective action.
     */
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
        RetryDecision that = (RetryDecision) o;
        return nextRetryCount == that.nextRetryCount &&
                classification == that.classification &&
                Objects.equals(delay, that.delay) &&
                reasonCode == that.reasonCode &&
                Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(classification, nextRetryCount, delay, reasonCode, message);
    }

    @Override
    public String toString() {
        return "RetryDecision{" +
                "classification=" + classification +
                ", nextRetryCount=" + nextRetryCount +
                ", delay=" + delay +
                ", reasonCode=" + reasonCode +
                ", message='" + message + '\'' +
                '}';
    }
}
