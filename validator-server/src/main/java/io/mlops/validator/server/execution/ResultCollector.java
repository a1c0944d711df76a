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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mlops.validator.api.model.CellResult;
import io.mlops.validator.api.model.CellStatus;
import io.mlops.validator.common.util.SanitizerExt;
import io.mlops.validator.common.util.StringExt;

import static java.lang.String.format;

/**
 * Extracts the notebook execution report from the validator container log.
 */
public class ResultCollector {

    public static final String SUMMARY_MARKER = "Results Summary:";

    static final int MAX_TRACEBACK_LENGTH = 2000;
    static final String TRACEBACK_TRUNCATION_SUFFIX = "\n... (truncated)";
    static final int MAX_ERROR_MESSAGE_LENGTH = 500;
    static final String ERROR_MESSAGE_TRUNCATION_SUFFIX = "... (truncated)";

    private static final int MAX_LOG_ERROR_LINES = 5;
    private static final String[] LOG_ERROR_PATTERNS = {"ERROR:", "Error:", "FAILED:", "Failed:", "Exception:", "Traceback"};

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Parses the JSON object printed after the summary marker, from its first opening brace to the last closing
     * brace of the log.
     *
     * @throws IllegalArgumentException if the log has no parsable summary
     */
    public NotebookExecutionReport parse(String log) {
        int markerIdx = log.indexOf(SUMMARY_MARKER);
        if (markerIdx < 0) {
            throw new IllegalArgumentException("results summary not found in logs");
        }
        String section = log.substring(markerIdx + SUMMARY_MARKER.length());
        int first = section.indexOf('{');
        int last = section.lastIndexOf('}');
        if (first < 0 || last < first) {
            throw new IllegalArgumentException("results summary has no JSON object");
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(section.substring(first, last + 1));
        } catch (IOException e) {
            throw new IllegalArgumentException("malformed results JSON: " + e.getMessage(), e);
        }

        List<CellResult> cells = new ArrayList<>();
        for (JsonNode cell : root.path("cells")) {
            cells.add(toCellResult(cell));
        }
        JsonNode statistics = root.path("statistics");
        return new NotebookExecutionReport(
                root.path("status").asText(""),
                SanitizerExt.sanitizeText(root.path("error").asText("")),
                root.path("exit_code").asInt(0),
                root.path("notebook_path").asText(""),
                root.path("execution_duration_seconds").asLong(0),
                cells,
                statistics.path("total_cells").asInt(cells.size()),
                statistics.path("code_cells").asInt(0),
                statistics.path("failed_cells").asInt(0),
                statistics.path("success_rate").asDouble(100.0)
        );
    }

    public String summaryMessage(NotebookExecutionReport report) {
        if (NotebookExecutionReport.STATUS_FAILED.equals(report.getStatus())) {
            return format("Validation failed: %s", report.getError());
        }
        return format("Validation completed: %d/%d cells succeeded (%.1f%% success rate)",
                report.getCodeCells() - report.getFailedCells(),
                report.getCodeCells(),
                report.getSuccessRate()
        );
    }

    /**
     * Returns up to five log lines that look like errors, for failures without a parsable report. Credentials are
     * masked, as the lines end up in the job status.
     */
    public String extractErrorLines(String log) {
        List<String> errorLines = new ArrayList<>();
        for (String line : log.split("\n")) {
            for (String pattern : LOG_ERROR_PATTERNS) {
                if (line.contains(pattern)) {
                    errorLines.add(SanitizerExt.sanitizeText(line.trim()));
                    break;
                }
            }
            if (errorLines.size() == MAX_LOG_ERROR_LINES) {
                break;
            }
        }
        return String.join("\n", errorLines);
    }

    private static CellResult toCellResult(JsonNode cell) {
        int index = cell.path("cell_index").asInt();
        String status = cell.path("status").asText("");
        long executionTimeMs = Math.round(cell.path("duration_seconds").asDouble(0) * 1000);
        if (NotebookExecutionReport.STATUS_SUCCEEDED.equals(status)) {
            return new CellResult(index, CellStatus.Success, executionTimeMs, "", "");
        }
        if (NotebookExecutionReport.STATUS_FAILED.equals(status)) {
            List<String> traceback = new ArrayList<>();
            for (JsonNode line : cell.path("traceback")) {
                traceback.add(line.asText());
            }
            String output = StringExt.truncate(
                    SanitizerExt.sanitizeText(String.join("\n", traceback)), MAX_TRACEBACK_LENGTH, TRACEBACK_TRUNCATION_SUFFIX
            );
            String errorMessage = StringExt.truncate(
                    SanitizerExt.sanitizeText(cell.path("error").asText("")), MAX_ERROR_MESSAGE_LENGTH, ERROR_MESSAGE_TRUNCATION_SUFFIX
            );
            return new CellResult(index, CellStatus.Failure, executionTimeMs, output, errorMessage);
        }
        if ("markdown".equals(cell.path("cell_type").asText())) {
            return new CellResult(index, CellStatus.Skipped, 0, "", "");
        }
        return new CellResult(index, CellStatus.Success, executionTimeMs, "", "");
    }
}
