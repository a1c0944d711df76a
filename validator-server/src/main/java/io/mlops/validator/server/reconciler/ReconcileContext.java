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

import java.util.concurrent.atomic.AtomicBoolean;

import io.mlops.validator.api.model.JobKey;

/**
 * State of one in-flight reconcile. The work queue cancels it when the job is deleted, after which the reconcile
 * must not write the job status anymore.
 */
public class ReconcileContext {

    private final JobKey key;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public ReconcileContext(JobKey key) {
        this.key = key;
    }

    public JobKey getKey() {
        return key;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        cancelled.set(true);
    }

    @Override
    public String toString() {
        return "ReconcileContext{" +
                "key=" + key +
                ", cancelled=" + cancelled.get() +
                '}';
    }
}
