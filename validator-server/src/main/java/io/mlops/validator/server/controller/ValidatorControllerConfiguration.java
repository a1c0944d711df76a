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

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "notebook.validator.controller")
public interface ValidatorControllerConfiguration {

    /**
     * @return whether or not the controller processes job events
     */
    @DefaultValue("true")
    boolean isEnabled();

    /**
     * @return the number of reconcile worker threads
     */
    @DefaultValue("4")
    int getWorkerCount();

    /**
     * @return the interval at which every job is re-queued, even without a change
     */
    @DefaultValue("300000")
    long getResyncIntervalMs();

    /**
     * @return the delay before a job is reconciled again after an unexpected reconcile error
     */
    @DefaultValue("5000")
    long getErrorRequeueDelayMs();

    @DefaultValue("30000")
    long getBuildPollIntervalMs();

    @DefaultValue("10000")
    long getPodPollIntervalMs();

    /**
     * @return the maximum number of failed attempts, after which a job fails with the retries exhausted reason
     */
    @DefaultValue("3")
    int getMaxRetries();

    /**
     * @return the job timeout applied when the job spec does not set one (duration string)
     */
    @DefaultValue("30m")
    String getDefaultJobTimeout();

    /**
     * @return the build timeout applied when the build configuration does not set one (duration string)
     */
    @DefaultValue("15m")
    String getDefaultBuildTimeout();

    /**
     * @return the maximum time to wait for the reconcile workers to finish on shutdown
     */
    @DefaultValue("10000")
    long getShutdownTimeoutMs();
}
