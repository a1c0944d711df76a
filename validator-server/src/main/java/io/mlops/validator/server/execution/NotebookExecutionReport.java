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

import java.util.List;

import com.google.common.collect.ImmutableList;
import io.mlops.validator.api.model.CellResult;
import io.mlops.validator.api.model.CellStatus;

/**
 * Summary printed by the validator container after the notebook run.
 */
public class NotebookExecutionReport {

    public static final String STATUS_SUCCEEDED = "succeeded";
    public static final String STATUS_FAILED = "failed";

    private final String status;
    private final String error;
    private final int exitCode;
    private final String notebookPath;
    private final long executionDurationSeconds;
    private final List<CellResult> cells;
    private final int totalCells;
    private final int codeCells;
    private final int failedCells;
    private final double successRate;

    public NotebookExecutionReport(String status,
                                   String error,
                                   int exitCode,
                                   String notebookPath,
                                   long executionDurationSeconds,
                                   List<CellResult> cells,
                                   int totalCells,
                                   int codeCells,
                                   int failedCells,
                                   double successRate) {
        this.status = status;
        this.error = error == null ? "" : error;
        this.exitCode = exitCode;
        this.notebookPath = notebookPath;
        this.executionDurationSeconds = executionDurationSeconds;
        this.cells = ImmutableList.copyOf(cells);
        this.totalCells = totalCells;
        this.codeCells = codeCells;
        this.failedCells = failedCells;
        this.successRate = successRate;
    }

    public String getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getNotebookPath() {
        return notebookPath;
    }

    public long getExecutionDurationSeconds() {
        return executionDurationSeconds;
    }

    public List<CellResult> getCells() {
        return cells;
    }

    public int getTotalCells() {
        return totalCells;
    }

    public int getCodeCells() {
        return codeCells;
    }

    public int getFailedCells() {
        return failedCells;
    }

    public double getSuccessRate() {
        return successRate;
    }

    /**
     * The notebook failed if the run reported a failure, or if any cell failed.
     */
    public boolean isFailed() {
        return STATUS_FAILED.equals(status) || cells.stream().anyMatch(c -> c.getStatus() == CellStatus.Failure);
    }

    @Override
    public String toString() {
        return "NotebookExecutionReport{" +
                "status='" + status + '\'' +
                ", error='" + error + '\'' +
                ", exitCode=" + exitCode +
                ", notebookPath='" + notebookPath + '\'' +
                ", executionDurationSeconds=" + executionDurationSeconds +
                ", cells=" + cells.size() +
                ", codeCells=" + codeCells +
                ", failedCells=" + failedCells +
                ", successRate=" + successRate +
                '}';
    }
}
