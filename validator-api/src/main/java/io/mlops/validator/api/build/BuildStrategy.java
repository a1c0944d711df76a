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

package io.mlops.validator.api.build;

import java.util.Optional;

import io.mlops.validator.api.model.BuildConfig;
import io.mlops.validator.api.model.ValidationJobSpec;
import io.mlops.validator.api.service.ValidatorException;

/**
 * Pluggable image build backend. Implementations keep no per-job state in memory. Every build resource they create
 * is labeled with the job identity, and all lookups are label queries, so a strategy instance can serve any job
 * after a restart.
 */
public interface BuildStrategy {

    /**
     * Unique strategy name, stored in the job status.
     */
    String getName();

    /**
     * Human readable description of the capability checked by {@link #detect(ClusterCapabilities)}.
     */
    String getCapabilityDescription();

    /**
     * Returns true if the cluster has the subsystem this strategy needs. Must not mutate anything.
     */
    boolean detect(ClusterCapabilities capabilities);

    /**
     * Checks the strategy specific part of the build configuration.
     *
     * @throws ValidatorException with {@link ValidatorException.ErrorCategory#ConfigurationError} if invalid
     */
    void validate(BuildConfig config);

    /**
     * Creates the build resources for the given attempt. Resources that already exist are reused.
     */
    BuildInfo createBuild(BuildHandle handle, ValidationJobSpec spec);

    /**
     * Returns the state of the build run of the given attempt, or {@link Optional#empty()} if it does not exist.
     */
    Optional<BuildInfo> getStatus(BuildHandle handle);

    /**
     * Returns the image produced by a completed build of the given attempt.
     */
    Optional<String> getImage(BuildHandle handle);

    /**
     * Deletes all build resources of the handle's job. Resources already gone are not an error.
     */
    void delete(BuildHandle handle);
}
