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

import com.netflix.spectator.api.Registry;
import io.mlops.validator.common.util.time.Clock;

/**
 * Collection of core services used by all notebook validator components.
 */
public interface ValidatorRuntime {

    /**
     * Returns the configured Spectator registry.
     */
    Registry getRegistry();

    /**
     * Returns the configured clock.
     */
    Clock getClock();
}
