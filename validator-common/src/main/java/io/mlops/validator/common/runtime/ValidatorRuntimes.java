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

package io.mlops.validator.common.runtime;

import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import io.mlops.validator.common.runtime.internal.DefaultValidatorRuntime;
import io.mlops.validator.common.util.time.Clocks;
import io.mlops.validator.common.util.time.TestClock;

public final class ValidatorRuntimes {

    private ValidatorRuntimes() {
    }

    public static ValidatorRuntime internal(Registry registry) {
        return new DefaultValidatorRuntime(registry, Clocks.system());
    }

    public static ValidatorRuntime test() {
        return test(Clocks.test());
    }

    public static ValidatorRuntime test(TestClock clock) {
        return new DefaultValidatorRuntime(new DefaultRegistry(), clock);
    }
}
