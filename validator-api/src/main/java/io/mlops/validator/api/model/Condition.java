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

import com.google.common.base.Preconditions;

/**
 * Typed, timestamped assertion about one aspect of a job. A job status holds at most one condition of each type.
 */
public class Condition {

    private final ConditionType type;
    private final ConditionStatus status;
    private final String reason;
    private final String message;
    private final long lastTransitionTime;

    public Condition(ConditionType type, ConditionStatus status, String reason, String message, long lastTransitionTime) {
        this.type = Preconditions.checkNotNull(type, "condition type is null");
        this.status = Preconditions.checkNotNull(status, "condition status is null");
        this.reason = reason == null ? "" : reason;
        this.message = message == null ? "" : message;
        this.lastTransitionTime = lastTransitionTime;
    }

    public ConditionType getType() {
        return type;
    }

    public ConditionStatus getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Time of the last status change, not of the last update.
     */
    public long getLastTransitionTime() {
        return lastTransitionTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Condition condition = (Condition) o;
        return lastTransitionTime == condition.lastTransitionTime &&
                type == condition.type &&
                status == condition.status &&
                Objects.equals(reason, condition.reason) &&
                Objects.equals(message, condition.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, status, reason, message, lastTransitionTime);
    }

    @Override
    public String toString() {
        return "Condition{" +
                "type=" + type +
                ", status=" + status +
                ", reason='" + reason + '\'' +
                ", message='" + message + '\'' +
                ", lastTransitionTime=" + lastTransitionTime +
                '}';
    }
}
