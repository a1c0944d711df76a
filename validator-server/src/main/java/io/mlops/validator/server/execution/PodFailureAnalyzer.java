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
import java.util.Locale;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.ContainerStateTerminated;
import io.fabric8.kubernetes.api.model.ContainerStateWaiting;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodCondition;
import io.mlops.validator.api.model.ReasonCode;
import io.mlops.validator.api.service.ValidatorException.ErrorCategory;

import static java.lang.String.format;

/**
 * Classifies validation pod failures from the container states and the pod conditions. Init containers are
 * inspected first, then the main containers, then the pod conditions.
 */
public class PodFailureAnalyzer {

    private static final String IMAGE_PULL_BACK_OFF = "ImagePullBackOff";
    private static final String ERR_IMAGE_PULL = "ErrImagePull";
    private static final String CRASH_LOOP_BACK_OFF = "CrashLoopBackOff";
    private static final String RUN_CONTAINER_ERROR = "RunContainerError";
    private static final String CREATE_CONTAINER_CONFIG_ERROR = "CreateContainerConfigError";
    private static final String OOM_KILLED = "OOMKilled";

    /**
     * Analyzes a pod in the Failed phase. Always returns a result, falling back to a retriable unknown failure.
     */
    public PodFailureAnalysis analyze(Pod pod) {
        Optional<PodFailureAnalysis> containerFailure = analyzeContainers(pod, true);
        if (containerFailure.isPresent()) {
            return containerFailure.get();
        }
        for (PodCondition condition : conditionsOf(pod)) {
            if ("PodScheduled".equals(condition.getType()) && "False".equals(condition.getStatus())
                    && "Unschedulable".equals(condition.getReason())) {
                return new PodFailureAnalysis(ErrorCategory.TransientInfra, ReasonCode.TransientInfraError, null, false, false,
                        condition.getMessage(),
                        "Pod cannot be scheduled. Check resource requests, node selectors and cluster capacity."
                );
            }
        }
        String detail = pod.getStatus() == null ? "" : pod.getStatus().getMessage();
        return new PodFailureAnalysis(ErrorCategory.RetriableExecutionFailure, ReasonCode.PodFailed, null, false, false,
                detail,
                "Pod failed for an unknown reason. Check the pod events and logs."
        );
    }

    /**
     * Looks for failures that show up before a pod leaves the Pending phase, like image pull errors or security
     * context violations. Returns empty if the pod may still start.
     */
    public Optional<PodFailureAnalysis> analyzePending(Pod pod) {
        return analyzeContainers(pod, false);
    }

    private Optional<PodFailureAnalysis> analyzeContainers(Pod pod, boolean includeTerminated) {
        if (pod.getStatus() == null) {
            return Optional.empty();
        }
        for (ContainerStatus status : nullSafe(pod.getStatus().getInitContainerStatuses())) {
            Optional<PodFailureAnalysis> analysis = analyzeContainer(status, true, includeTerminated);
            if (analysis.isPresent()) {
                return analysis;
            }
        }
        for (ContainerStatus status : nullSafe(pod.getStatus().getContainerStatuses())) {
            Optional<PodFailureAnalysis> analysis = analyzeContainer(status, false, includeTerminated);
            if (analysis.isPresent()) {
                return analysis;
            }
        }
        return Optional.empty();
    }

    private Optional<PodFailureAnalysis> analyzeContainer(ContainerStatus status, boolean init, boolean includeTerminated) {
        if (status.getState() == null) {
            return Optional.empty();
        }
        ContainerStateWaiting waiting = status.getState().getWaiting();
        if (waiting != null && waiting.getReason() != null) {
            Optional<PodFailureAnalysis> analysis = analyzeWaiting(status.getName(), init, waiting);
            if (analysis.isPresent()) {
                return analysis;
            }
        }
        ContainerStateTerminated terminated = status.getState().getTerminated();
        if (includeTerminated && terminated != null && terminated.getExitCode() != null && terminated.getExitCode() != 0) {
            return Optional.of(analyzeTerminated(status.getName(), init, terminated));
        }
        return Optional.empty();
    }

    private Optional<PodFailureAnalysis> analyzeWaiting(String container, boolean init, ContainerStateWaiting waiting) {
        String message = waiting.getMessage();
        switch (waiting.getReason()) {
            case IMAGE_PULL_BACK_OFF:
            case ERR_IMAGE_PULL:
                return Optional.of(new PodFailureAnalysis(ErrorCategory.TransientInfra, ReasonCode.ImagePullFailed, container, init, false,
                        message,
                        init
                                ? "Image pull failed for the git clone init container. Check the image registry, credentials and rate limits, or enable the image build to skip the init container."
                                : "Image pull failed. Check that the image exists, the registry credentials and rate limits."
                ));
            case CRASH_LOOP_BACK_OFF:
                return Optional.of(new PodFailureAnalysis(ErrorCategory.RetriableExecutionFailure, ReasonCode.ContainerCrashed, container, init, false,
                        message,
                        "Container is crashing repeatedly. Check the container logs and the notebook dependencies."
                ));
            case RUN_CONTAINER_ERROR:
                boolean scc = isSccViolation(message);
                String action;
                if (scc) {
                    action = init
                            ? "Security context constraint violation in the git clone init container. Enable the image build to skip the init container."
                            : "Security context constraint violation. Use an image that runs as a non-root user, or build one with the s2i or tekton strategy.";
                } else {
                    action = "Container failed to run. Check the container configuration and logs.";
                }
                return Optional.of(new PodFailureAnalysis(ErrorCategory.ConfigurationError, ReasonCode.ConfigurationInvalid, container, init, scc,
                        message, action
                ));
            case CREATE_CONTAINER_CONFIG_ERROR:
                return Optional.of(new PodFailureAnalysis(ErrorCategory.ConfigurationError, ReasonCode.ConfigurationInvalid, container, init, false,
                        message,
                        "Container configuration error. Check that the referenced secrets and config maps exist, and the volume mounts and security context."
                ));
            default:
                return Optional.empty();
        }
    }

    private PodFailureAnalysis analyzeTerminated(String container, boolean init, ContainerStateTerminated terminated) {
        int exitCode = terminated.getExitCode();
        if (OOM_KILLED.equals(terminated.getReason())) {
            return new PodFailureAnalysis(ErrorCategory.ResourceExhaustion, ReasonCode.ResourceExhausted, container, init, false,
                    terminated.getMessage(),
                    "Container was killed because it ran out of memory. Increase the memory limit in podConfig.resources."
            );
        }
        if (init) {
            return new PodFailureAnalysis(ErrorCategory.RetriableExecutionFailure, ReasonCode.InitContainerFailed, container, true, false,
                    terminated.getMessage(),
                    format("Init container failed with exit code %d. Check the repository URL, ref and credentials.", exitCode)
            );
        }
        return new PodFailureAnalysis(ErrorCategory.RetriableExecutionFailure, ReasonCode.PodFailed, container, false, false,
                terminated.getMessage(),
                format("Container terminated with reason %s and exit code %d. Check the logs for details.", terminated.getReason(), exitCode)
        );
    }

    static boolean isSccViolation(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("runasnonroot") || lower.contains("scc") || lower.contains("security context");
    }

    private static List<PodCondition> conditionsOf(Pod pod) {
        return pod.getStatus() == null ? Collections.emptyList() : nullSafe(pod.getStatus().getConditions());
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? Collections.emptyList() : list;
    }
}
