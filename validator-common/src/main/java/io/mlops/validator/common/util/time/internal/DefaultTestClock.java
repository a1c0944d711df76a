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

package io.mlops.validator.common.util.time.internal;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Preconditions;
import io.mlops.validator.common.util.time.TestClock;

public class DefaultTestClock implements TestClock {

    // 2022-01-01T00:00:00Z, so timestamps in test output are easy to read.
    private static final long DEFAULT_START_TIME_MS = 1_640_995_200_000L;

    private final AtomicLong currentTimeMs;

    public DefaultTestClock() {
        this(DEFAULT_START_TIME_MS);
    }

    public DefaultTestClock(long startTimeMs) {
        this.currentTimeMs = new AtomicLong(startTimeMs);
    }

    @Override
    public long advanceTime(long interval, TimeUnit timeUnit) {
        Preconditions.checkArgument(interval >= 0, "Time cannot move backwards: %s", interval);
        return currentTimeMs.addAndGet(timeUnit.toMillis(interval));
    }

    @Override
    public long wallTime() {
        return currentTimeMs.get();
    }
}
