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

package io.mlops.validator.common.util.time;

/**
 * Source of the current time. Job timestamps are wall clock milliseconds, and all timeouts and backoff windows
 * are measured against them.
 */
public interface Clock {

    /**
     * Current time in milliseconds since the epoch.
     */
    long wallTime();

    /**
     * Milliseconds elapsed since the given wall clock timestamp.
     */
    default long elapsedSince(long timestampMs) {
        return wallTime() - timestampMs;
    }
}
