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
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.fabric8.kubernetes.api.model.Pod;
import io.mlops.validator.api.model.ValidationJob;
import io.mlops.validator.api.service.ValidatorException;
import io.mlops.validator.common.util.SanitizerExt;
import io.mlops.validator.server.kubernetes.ClusterApiFacade;
import io.mlops.validator.server.kubernetes.KubeApiException;
import io.mlops.validator.server.kubernetes.ResourceLabels;
import io.mlops.validator.server.metrics.ValidatorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.mlops.validator.common.util.StringExt.isNotEmpty;

/**
 * Runs the validation pod of a job. Each call either creates the pod of the current attempt, or inspects the pod
 * recorded in the job status. It never waits for the pod to progress.
 */
@Singleton
public class ExecutionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionOrchestrator.class);

    private final ClusterApiFacade clusterApi;
    private final ValidationPodFactory podFactory;
    private final ValidatorMetrics metrics;
    private final PodFailureAnalyzer failureAnalyzer = new PodFailureAnalyzer();
    private final ResultCollector resultCollector = new ResultCollector();

    @Inject
    public ExecutionOrchestrator(ClusterApiFacade clusterApi, ValidationPodFactory podFactory, ValidatorMetrics metrics) {
        this.clusterApi = clusterApi;
        this.podFactory = podFactory;
        this.metrics = metrics;
    }

    /**
     * @param image image of the validator container
     * @param builtImage true if the image was built for the job, and already contains the notebook
     */
    public ExecutionOutcome execute(ValidationJob job, String image, boolean builtImage) {
        String recordedPodName = job.getStatus().getValidationPodName();
        if (isNotEmpty(recordedPodName)) {
            Optional<Pod> recorded = findPod(job, recordedPodName);
            if (recorded.isPresent()) {
                return inspect(job, recorded.get());
            }
            logger.warn("Validation pod {}/{} recorded for job {} is gone, starting a new one", job.getNamespace(), recordedPodName, job.getKey());
        }

        int attempt = job.getStatus().getRetryCount() + 1;
        String podName = ValidationPodFactory.podName(job, attempt);
        Optional<Pod> existing = findPod(job, podName);
        if (existing.isPresent()) {
            logger.info("Adopting existing validation pod {}/{}", job.getNamespace(), podName);
            return inspect(job, existing.get());
        }

        deletePods(job);
        clusterApi.createPod(podFactory.newValidationPod(job, attempt, image, builtImage));
        metrics.validationPodCreated();
        logger.info("Created validation pod {}/{} with image {}", job.getNamespace(), podName, image);
        return ExecutionOutcome.running(podName, "Validation pod " + podName + " created");
    }

    /**
     * Deletes all validation pods of the job. Returns the number of pods deleted.
     */
    public int deletePods(ValidationJob job) {
        List<Pod> pods = clusterApi.listPods(job.getNamespace(), ResourceLabels.validationSelector(job.getUid()));
        for (Pod pod : pods) {
            clusterApi.deletePod(job.getNamespace(), pod.getMetadata().getName());
            logger.info("Deleted validation pod {}/{}", job.getNamespace(), pod.getMetadata().getName());
        }
        return pods.size();
    }

    private Optional<Pod> findPod(ValidationJob job, String podName) {
        return clusterApi.listPods(job.getNamespace(), ResourceLabels.validationSelector(job.getUid())).stream()
                .filter(pod -> podName.equals(pod.getMetadata().getName()))
                .findFirst();
    }

    private ExecutionOutcome inspect(ValidationJob job, Pod pod) {
        String podName = pod.getMetadata().getName();
        String phase = pod.getStatus() == null || pod.getStatus().getPhase() == null ? "Unknown" : pod.getStatus().getPhase();
        switch (phase) {
            case "Pending":
                Optional<PodFailureAnalysis> early = failureAnalyzer.analyzePending(pod);
                if (early.isPresent()) {
                    logger.info("Validation pod {}/{} failed before starting: {}", job.getNamespace(), podName, early.get());
                    return ExecutionOutcome.failed(podName, Collections.emptyList(), early.get().toException());
                }
                return ExecutionOutcome.running(podName, "Validation pod " + podName + " is pending");
            case "Succeeded":
                return onSucceeded(job, podName);
            case "Failed":
                return onFailed(job, pod);
            default:
                logger.debug("Validation pod {}/{} is in phase {}", job.getNamespace(), podName, phase);
                return ExecutionOutcome.running(podName, "Validation pod " + podName + " is running");
        }
    }

    private ExecutionOutcome onSucceeded(ValidationJob job, String podName) {
        String log = clusterApi.getPodLog(job.getNamespace(), podName, ValidationPodFactory.VALIDATOR_CONTAINER);
        NotebookExecutionReport report;
        try {
            report = resultCollector.parse(log);
        } catch (IllegalArgumentException e) {
            logger.warn("Cannot parse the results of validation pod {}/{}: {}", job.getNamespace(), podName, e.getMessage());
            return ExecutionOutcome.succeeded(podName, Collections.emptyList(), "Validation completed but failed to parse results: " + SanitizerExt.sanitizeText(e.getMessage()));
        }
        if (report.isFailed()) {
            return ExecutionOutcome.failed(podName, report.getCells(), ValidatorException.notebookExecutionFailed(failureMessage(report)));
        }
        return ExecutionOutcome.succeeded(podName, report.getCells(), resultCollector.summaryMessage(report));
    }

    private ExecutionOutcome onFailed(ValidationJob job, Pod pod) {
        String podName = pod.getMetadata().getName();
        String log = readLogForDiagnostics(job, podName);

        try {
            NotebookExecutionReport report = resultCollector.parse(log);
            if (report.isFailed()) {
                return ExecutionOutcome.failed(podName, report.getCells(), ValidatorException.notebookExecutionFailed(failureMessage(report)));
            }
        } catch (IllegalArgumentException e) {
            logger.debug("No results summary in the log of failed pod {}/{}: {}", job.getNamespace(), podName, e.getMessage());
        }

        PodFailureAnalysis analysis = failureAnalyzer.analyze(pod);
        String message = SanitizerExt.sanitizeText(analysis.getMessage());
        logger.info("Validation pod {}/{} failed ({}): {}", job.getNamespace(), podName, analysis.getReasonCode(), message);
        String logErrors = resultCollector.extractErrorLines(log);
        if (!logErrors.isEmpty()) {
            message = message + " Log error: " + logErrors;
        }
        return ExecutionOutcome.failed(podName, Collections.emptyList(),
                ValidatorException.podFailure(analysis.getCategory(), analysis.getReasonCode(), message));
    }

    /**
     * Logs only enrich the failure message, so a failed read does not block the failure handling.
     */
    private String readLogForDiagnostics(ValidationJob job, String podName) {
        try {
            return clusterApi.getPodLog(job.getNamespace(), podName, ValidationPodFactory.VALIDATOR_CONTAINER);
        } catch (KubeApiException e) {
            logger.warn("Cannot read the log of failed validation pod {}/{}: {}", job.getNamespace(), podName, e.getMessage());
            return "";
        }
    }

    private String failureMessage(NotebookExecutionReport report) {
        if (NotebookExecutionReport.STATUS_FAILED.equals(report.getStatus())) {
            return resultCollector.summaryMessage(report);
        }
        return String.format("Validation failed: %d of %d code cells failed. See the cell results for the tracebacks",
                report.getFailedCells(), report.getCodeCells());
    }
}
