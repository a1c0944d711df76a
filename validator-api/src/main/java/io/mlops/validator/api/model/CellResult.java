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

import java.util.Objects;

/**
 * Execution outcome of a single notebook cell.
 */
public class CellResult {

    private final int cellIndex;
    private final CellStatus status;
    private final long executionTimeMs;
    private final String output;
    private final String errorMessage;

    public CellResult(int cellIndex, CellStatus status, long executionTimeMs, String output, String errorMessage) {
        this.cellIndex = cellIndex;
        this.status = status;
        this.executionTimeMs = executionTimeMs;
        this.output = output == null ? "" : output;
        this.errorMessage = errorMessage == null ? "" : errorMessage;
    }

    public int getCellIndex() {
        return cellIndex;
    }

    public CellStatus getStatus() {
        return status;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public String getOutput() {
        return output;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CellResult that = (CellResult) o;
        return cellIndex == that.cellIndex &&
                executionTimeMs == that.executionTimeMs &&
                status == that.status &&
                Objects.equals(output, that.output) &&
                Objects.equals(errorMessage, that.errorMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cellIndex, status, executionTimeMs, output, errorMessage);
    }

    @Override
    public String toString() {
        return "CellResult{" +
                "cellIndex=" + cellIndex +
                ", status=" + status +
                ", executionTimeMs=" + executionTimeMs +
                ", errorMessage='" + errorMessage + '\'' +
                '}';
    }
}
