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

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * {@link Clock} with manually controlled time, used by the reconciler and work queue tests.
 */
public interface TestClock extends Clock {

    long advanceTime(long interval, TimeUnit timeUnit);

    default long advanceTime(Duration duration) {
        return advanceTime(duration.toMillis(), TimeUnit.MILLISECONDS);
    }
}
