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

import java.util.Objects;

import io.mlops.validator.api.model.JobKey;

/**
 * Change notification for a validation job, or for one of its child pods. Events carry only the job key, as
 * the reconciler always reads the current state from the cluster.
 */
public class ValidationJobEvent {

    public enum EventType {
        Updated,
        Deleted
    }

    private final EventType type;
    private final JobKey key;

    private ValidationJobEvent(EventType type, JobKey key) {
        this.type = type;
        this.key = key;
    }

    public static ValidationJobEvent updated(JobKey key) {
        return new ValidationJobEvent(EventType.Updated, key);
    }

    public static ValidationJobEvent deleted(JobKey key) {
        return new ValidationJobEvent(EventType.Deleted, key);
    }

    public EventType getType() {
        return type;
    }

    public JobKey getKey() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ValidationJobEvent that = (ValidationJobEvent) o;
        return type == that.type && Objects.equals(key, that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, key);
    }

    @Override
    public String toString() {
        return "ValidationJobEvent{" +
                "type=" + type +
                ", key=" + key +
                '}';
    }
}
