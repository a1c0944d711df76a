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

/**
 * Validation job life cycle. The declaration order is the forward order of the state machine.
 */
public enum JobPhase {
    Pending,
    Initializing,
    Building,
    BuildComplete,
    ValidationRunning,
    Succeeded,
    Failed;

    public boolean isTerminal() {
        return this == Succeeded || this == Failed;
    }

    /**
     * Returns true if a job in this phase may move to the given phase. Phases only move forward, except the
     * Building to Building retry loop and the transitions into a terminal phase.
     */
    public boolean canTransitionTo(JobPhase next) {
        if (isTerminal()) {
            return false;
        }
        if (next.isTerminal()) {
            return true;
        }
        if (this == Building && next == Building) {
            return true;
        }
        return next.ordinal() > ordinal();
    }
}
