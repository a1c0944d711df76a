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
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Retry delays indexed by the retry count. Counts beyond the schedule length use the last delay.
 */
public class BackoffSchedule {

    private static final BackoffSchedule DEFAULT = new BackoffSchedule(ImmutableList.of(
            Duration.ofMinutes(1),
            Duration.ofMinutes(2),
            Duration.ofMinutes(5)
    ));

    private final List<Duration> delays;

    public BackoffSchedule(List<Duration> delays) {
        Preconditions.checkArgument(!delays.isEmpty(), "empty backoff schedule");
        this.delays = ImmutableList.copyOf(delays);
    }

    public static BackoffSchedule defaultSchedule() {
        return DEFAULT;
    }

    /**
     * Returns the delay before the given retry, where the first retry has number 1.
     */
    public Duration delayFor(int retryNumber) {
        int index = Math.max(0, retryNumber - 1);
        return delays.get(Math.min(index, delays.size() - 1));
    }
}
