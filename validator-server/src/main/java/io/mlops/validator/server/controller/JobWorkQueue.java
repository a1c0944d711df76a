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

package io.mlops.validator.server.controller;

import java.time.Duration;

import io.mlops.validator.api.model.JobKey;

/**
 * Keyed queue of reconcile requests. At most one reconcile of a given job runs at a time. Requests for a job that
 * is already queued or running are coalesced into one follow-up run.
 */
public interface JobWorkQueue {

    void enqueue(JobKey key);

    /**
     * Schedules a reconcile after the given delay. An earlier pending request for the same job wins.
     */
    void enqueueAfter(JobKey key, Duration delay);

    /**
     * Drops pending requests of the job, and signals cancellation to its running reconcile, if any.
     */
    void cancel(JobKey key);

    /**
     * Number of jobs with a queued, delayed or running reconcile.
     */
    int size();

    void shutdown();
}
