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

package io.mlops.validator.server.retry;

public enum RetryClassification {

    /**
     * Infrastructure hiccup. Retried with backoff, without tearing anything down, and never fails the job by itself.
     */
    Transient,

    /**
     * Failed attempt. The failed resource is deleted, and the phase re-entered after backoff.
     */
    Retriable,

    /**
     * No further automatic retry. The job fails, and its resources are kept for inspection.
     */
    Terminal
}
