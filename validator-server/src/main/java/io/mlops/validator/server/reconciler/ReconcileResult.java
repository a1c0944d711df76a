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

package io.mlops.validator.server.reconciler;

import java.time.Duration;
import java.util.Objects;

/**
 * What the work queue does with a job key after a reconcile.
 */
public final class ReconcileResult {

    public enum Action {
        Done,
        RequeueNow,
        RequeueAfter
    }

    private static final ReconcileResult DONE = new ReconcileResult(Action.Done, Duration.ZERO);
    private static final ReconcileResult REQUEUE_NOW = new ReconcileResult(Action.RequeueNow, Duration.ZERO);

    private final Action action;
    private final Duration delay;

    private ReconcileResult(Action action, Duration delay) {
        this.action = action;
        this.delay = delay;
    }

    public static ReconcileResult done() {
        return DONE;
    }

    public static ReconcileResult requeueNow() {
        return REQUEUE_NOW;
    }

    public static ReconcileResult requeueAfter(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return REQUEUE_NOW;
        }
        return new ReconcileResult(Action.RequeueAfter, delay);
    }

    public Action getAction() {
        return action;
    }

    public Duration getDelay() {
        return delay;
    }

    public boolean isDone() {
        return action == Action.Done;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ReconcileResult that = (ReconcileResult) o;
        return action == that.action && Objects.equals(delay, that.delay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, delay);
    }

    @Override
    public String toString() {
        return action == Action.RequeueAfter ? "RequeueAfter(" + delay + ")" : action.name();
    }
}
