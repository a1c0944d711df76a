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

package io.mlops.validator.server.execution;

import java.util.Collections;
import java.util.List;

import io.mlops.validator.api.model.CellResult;
import io.mlops.validator.api.service.ValidatorException;

/**
 * Result of one validation pod poll.
 */
public class ExecutionOutcome {

    public enum State {
        /**
         * The pod was created, or it has not finished yet.
         */
        Running,
        Succeeded,
        Failed
    }

    private final State state;
    private final String podName;
    private final List<CellResult> results;
    private final String message;
    private final ValidatorException error;

    private ExecutionOutcome(State state, String podName, List<CellResult> results, String message, ValidatorException error) {
        this.state = state;
        this.podName = podName;
        this.results = results;
        this.message = message;
        this.error = error;
    }

    public static ExecutionOutcome running(String podName, String message) {
        return new ExecutionOutcome(State.Running, podName, Collections.emptyList(), message, null);
    }

    public static ExecutionOutcome succeeded(String podName, List<CellResult> results, String message) {
        return new ExecutionOutcome(State.Succeeded, podName, results, message, null);
    }

    public static ExecutionOutcome failed(String podName, List<CellResult> results, ValidatorException error) {
        return new ExecutionOutcome(State.Failed, podName, results, error.getMessage(), error);
    }

    public State getState() {
        return state;
    }

    public String getPodName() {
        return podName;
    }

    public List<CellResult> getResults() {
        return results;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Classified failure, set only in the {@link State#Failed} state.
     */
    public ValidatorException getError() {
        return error;
    }

    @Override
    public String toString() {
        return "ExecutionOutcome{" +
                "state=" + state +
                ", podName='" + podName + '\'' +
                ", results=" + results.size() +
                ", message='" + message + '\'' +
                '}';
    }
}
