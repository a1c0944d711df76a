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

package io.mlops.validator.server.reconciler;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.collect.ImmutableSet;
import io.mlops.validator.api.build.BuildHandle;
import io.mlops.validator.api.build.BuildInfo;
import io.mlops.validator.api.build.BuildStrategy;
import io.mlops.validator.api.build.ClusterCapabilities;
import io.mlops.validator.api.model.BuildConfig;
import io.mlops.validator.api.model.BuildPhase;
import io.mlops.validator.api.model.BuildStatus;
import io.mlops.validator.api.model.CellResult;
import io.mlops.validator.api.model.JobPhase;
import io.mlops.validator.api.model.ModelValidationConfig;
import io.mlops.validator.api.model.ModelValidationResult;
import io.mlops.validator.api.model.ReasonCode;
import io.mlops.validator.api.model.ValidationJob;
import io.mlops.validator.api.model.ValidationJobSpec;
import io.mlops.validator.api.model.ValidationJobStatus;
import io.mlops.validator.api.service.ValidatorException;
import io.mlops.validator.common.runtime.ValidatorRuntime;
import io.mlops.validator.common.util.DateTimeExt;
import io.mlops.validator.common.util.time.Clock;
import io.mlops.validator.server.build.BuildStrategyRegistry;
import io.mlops.validator.server.controller.ValidatorControllerConfiguration;
import io.mlops.validator.server.execution.ExecutionOrchestrator;
import io.mlops.validator.server.execution.ExecutionOutcome;
import io.mlops.validator.server.kubernetes.ClusterApiFacade;
import io.mlops.validator.server.kubernetes.ClusterCapabilityDetector;
import io.mlops.validator.server.kubernetes.KubeApiException;
import io.mlops.validator.server.kubernetes.ResourceLabels;
import io.mlops.validator.server.metrics.ValidatorMetrics;
import io.mlops.validator.server.retry.BackoffSchedule;
import io.mlops.validator.server.retry.RetryClassification;
import io.mlops.validator.server.retry.RetryClassifier;
import io.mlops.validator.server.retry.RetryDecision;
import io.mlops.validator.server.status.StatusUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.mlops.validator.common.util.StringExt.isEmpty;
import static io.mlops.validator.common.util.StringExt.isNotEmpty;

/**
 * Level triggered state machine of a validation job. A reconcile loads the job, handles deletion, spec changes and
 * the overall timeout, and then runs exactly one phase handler. Handlers never wait for a build or a pod; they
 * record what they observed and ask to be requeued. All child resources are found again by label on every call,
 * so a reconcile can be repeated any number of times.
 */
@Singleton
public class ValidationJobReconciler {

    private static final Logger logger = LoggerFactory.getLogger(ValidationJobReconciler.class);

    private static final Set<String> MODEL_VALIDATION_PHASES = ImmutableSet.of("clean", "existing", "both");

    private final ClusterApiFacade clusterApi;
    private final BuildStrategyRegistry strategyRegistry;
    private final ClusterCapabilityDetector capabilityDetector;
    private final ExecutionOrchestrator orchestrator;
    private final OwnedResourceCleaner resourceCleaner;
    private final StatusUpdater statusUpdater;
    private final ValidatorControllerConfiguration configuration;
    private final ValidatorMetrics metrics;
    private final Clock clock;
    private final BackoffSchedule backoffSchedule;
    private final RetryClassifier retryClassifier;

    @Inject
    public ValidationJobReconciler(ClusterApiFacade clusterApi,
                                   BuildStrategyRegistry strategyRegistry,
                                   ClusterCapabilityDetector capabilityDetector,
                                   ExecutionOrchestrator orchestrator,
                                   OwnedResourceCleaner resourceCleaner,
                                   StatusUpdater statusUpdater,
                                   ValidatorControllerConfiguration configuration,
                                   ValidatorRuntime runtime,
                                   ValidatorMetrics metrics) {
        this.clusterApi = clusterApi;
        this.strategyRegistry = strategyRegistry;
        this.capabilityDetector = capabilityDetector;
        this.orchestrator = orchestrator;
        this.resourceCleaner = resourceCleaner;
        this.statusUpdater = statusUpdater;
        this.configuration = configuration;
        this.metrics = metrics;
        this.clock = runtime.getClock();
        this.backoffSchedule = BackoffSchedule.defaultSchedule();
        this.retryClassifier = new RetryClassifier(backoffSchedule);
    }

    public ReconcileResult reconcile(ReconcileContext context) {
        long startTime = clock.wallTime();
        ReconcileResult result = null;
        try {
            result = doReconcile(context);
            return result;
        } finally {
            metrics.reconcileCompleted(result == null ? "error" : result.getAction().name(), clock.elapsedSince(startTime));
        }
    }

    private ReconcileResult doReconcile(ReconcileContext context) {
        if (context.isCancelled()) {
            return ReconcileResult.done();
        }
        Optional<ValidationJob> loaded = clusterApi.findValidationJob(context.getKey());
        if (!loaded.isPresent()) {
            logger.debug("Job {} not found, removing leftover resources", context.getKey());
            resourceCleaner.cleanupByOwner(context.getKey());
            metrics.jobState(context.getKey(), false);
            return ReconcileResult.done();
        }
        ValidationJob job = loaded.get();

        if (job.isDeletionRequested()) {
            return handleDeletion(job);
        }
        if (job.getSpecError().isPresent()) {
            return handleUnreadableSpec(context, job);
        }
        if (job.getStatus().getPhase() != null && job.getGeneration() > job.getStatus().getObservedGeneration()) {
            return handleGenerationChange(context, job);
        }
        JobPhase phase = job.getStatus().getPhase();
        if (phase != null && phase.isTerminal()) {
            return ReconcileResult.done();
        }
        if (phase != null && isJobTimedOut(job)) {
            return handleFailure(context, job, ValidatorException.jobTimeout(job.getName(), jobTimeoutOf(job.getSpec())), Collections.emptyList());
        }

        try {
            return dispatch(context, job);
        } catch (ValidatorException | KubeApiException e) {
            return handleFailure(context, job, e, Collections.emptyList());
        }
    }

    private ReconcileResult dispatch(ReconcileContext context, ValidationJob job) {
        JobPhase phase = job.getStatus().getPhase();
        if (phase == null) {
            return handleNew(context, job);
        }
        switch (phase) {
            case Pending:
                return handlePending(context, job);
            case Initializing:
                return handleInitializing(context, job);
            case Building:
                return handleBuilding(context, job);
            case BuildComplete:
                return handleBuildComplete(context, job);
            case ValidationRunning:
                return handleValidationRunning(context, job);
            default:
                return ReconcileResult.done();
        }
    }

    private ReconcileResult handleDeletion(ValidationJob job) {
        logger.info("Job {} is being deleted, removing its resources", job.getKey());
        resourceCleaner.cleanup(job.getNamespace(), job.getUid());
        resourceCleaner.cleanupByOwner(job.getKey());
        if (job.getFinalizers().contains(ResourceLabels.CLEANUP_FINALIZER)) {
            clusterApi.removeFinalizer(job.getKey(), ResourceLabels.CLEANUP_FINALIZER);
        }
        metrics.jobState(job.getKey(), false);
        return ReconcileResult.done();
    }

    /**
     * The spec hash is cleared, so that any later edit of the spec restarts the job.
     */
    private ReconcileResult handleUnreadableSpec(ReconcileContext context, ValidationJob job) {
        ValidationJobStatus status = job.getStatus();
        if (status.getPhase() == JobPhase.Failed && status.getObservedGeneration() >= job.getGeneration()) {
            return ReconcileResult.done();
        }
        ValidatorException error = ValidatorException.configurationInvalid(job.getSpecError().get());
        logger.error("Job {} has an unreadable spec: {}", job.getKey(), error.getMessage());
        metrics.retryClassified(RetryClassification.Terminal, error.getReasonCode());
        long now = clock.wallTime();
        write(context, job, status.toBuilder()
                .withPhase(JobPhase.Failed)
                .withStartTime(status.getStartTime() > 0 ? status.getStartTime() : now)
                .withCompletionTime(now)
                .withObservedGeneration(job.getGeneration())
                .withSpecHash("")
                .withReasonCode(error.getReasonCode())
                .withMessage(error.getMessage())
                .build()
        );
        return ReconcileResult.done();
    }

    /**
     * A generation bump restarts the job only if the spec content changed. Metadata only updates just record the
     * new generation.
     */
    private ReconcileResult handleGenerationChange(ReconcileContext context, ValidationJob job) {
        String specHash = SpecHasher.hash(job.getSpec());
        ValidationJobStatus status = job.getStatus();
        if (specHash.equals(status.getSpecHash())) {
            write(context, job, status.toBuilder().withObservedGeneration(job.getGeneration()).build());
            return ReconcileResult.requeueNow();
        }

        logger.info("Spec of job {} changed (generation {} -> {}), restarting it", job.getKey(), status.getObservedGeneration(), job.getGeneration());
        resourceCleaner.cleanup(job.getNamespace(), job.getUid());
        ValidationJobStatus restarted = ValidationJobStatus.newBuilder()
                .withPhase(JobPhase.Pending)
                .withStartTime(clock.wallTime())
                .withObservedGeneration(job.getGeneration())
                .withSpecHash(specHash)
                .withConditions(status.getConditions())
                .withMessage("Spec changed, restarting validation")
                .build();
        write(context, job, restarted);
        return ReconcileResult.requeueNow();
    }

    private ReconcileResult handleNew(ReconcileContext context, ValidationJob job) {
        ValidationJobStatus status = job.getStatus().toBuilder()
                .withPhase(JobPhase.Pending)
                .withStartTime(clock.wallTime())
                .withObservedGeneration(job.getGeneration())
                .withSpecHash(SpecHasher.hash(job.getSpec()))
                .withMessage("Validation job accepted")
                .build();
        write(context, job, status);
        return ReconcileResult.requeueNow();
    }

    private ReconcileResult handlePending(ReconcileContext context, ValidationJob job) {
        ValidationJob current = job;
        if (!job.getFinalizers().contains(ResourceLabels.CLEANUP_FINALIZER)) {
            current = clusterApi.addFinalizer(job.getKey(), ResourceLabels.CLEANUP_FINALIZER);
        }
        write(context, current, current.getStatus().toBuilder()
                .withPhase(JobPhase.Initializing)
                .withMessage("Validating the job configuration")
                .build()
        );
        return ReconcileResult.requeueNow();
    }

    private ReconcileResult handleInitializing(ReconcileContext context, ValidationJob job) {
        validateSpec(job.getSpec(), job.getNamespace());
        ModelValidationConfig modelValidation = job.getSpec().getModelValidation();
        ClusterCapabilities capabilities = job.getSpec().isBuildEnabled() || modelValidation.isEnabled()
                ? capabilityDetector.detect()
                : ClusterCapabilities.none();
        ValidationJobStatus.Builder statusBuilder = job.getStatus().toBuilder();
        if (modelValidation.isEnabled()) {
            statusBuilder.withModelValidationResult(checkServingPlatform(job, capabilities));
        }

        if (!job.getSpec().isBuildEnabled()) {
            write(context, job, statusBuilder
                    .withPhase(JobPhase.ValidationRunning)
                    .withMessage("Image build disabled, starting validation with image " + job.getSpec().getPodConfig().getContainerImage())
                    .build()
            );
            return ReconcileResult.requeueNow();
        }

        BuildStrategy strategy = strategyRegistry.resolve(job.getSpec().getBuildConfig(), capabilities);
        logger.info("Job {} uses build strategy {}", job.getKey(), strategy.getName());
        write(context, job, statusBuilder
                .withPhase(JobPhase.Building)
                .withBuildStatus(BuildStatus.newBuilder().withPhase(BuildPhase.Pending).withStrategy(strategy.getName()).build())
                .withMessage("Building image with strategy " + strategy.getName())
                .build()
        );
        return ReconcileResult.requeueNow();
    }

    private ReconcileResult handleBuilding(ReconcileContext context, ValidationJob job) {
        ValidationJobStatus status = job.getStatus();
        BuildStatus buildStatus = status.getBuildStatus().orElseThrow(() ->
                ValidatorException.configurationInvalid("job is in the Building phase without a selected build strategy")
        );
        BuildStrategy strategy = strategyRegistry.getStrategy(buildStatus.getStrategy());
        long now = clock.wallTime();

        Optional<BuildHandle> recorded = BuildHandle.fromBuildName(job.getNamespace(), job.getName(), job.getUid(), buildStatus.getBuildName());
        if (!recorded.isPresent()) {
            Optional<Duration> wait = remainingBackoff(status, now);
            if (wait.isPresent()) {
                logger.debug("Job {} waits {} before the next build attempt", job.getKey(), DateTimeExt.toDurationString(wait.get().toMillis()));
                return ReconcileResult.requeueAfter(wait.get());
            }
            return startBuild(context, job, strategy, buildStatus);
        }

        BuildHandle handle = recorded.get();
        String buildTimeout = buildTimeoutOf(job.getSpec().getBuildConfig());
        if (buildStatus.getStartTime() > 0 && clock.elapsedSince(buildStatus.getStartTime()) > parseTimeout(buildTimeout, configuration.getDefaultBuildTimeout())) {
            throw ValidatorException.buildTimeout(handle.getBuildName(), buildTimeout);
        }

        Optional<BuildInfo> observed = strategy.getStatus(handle);
        if (!observed.isPresent()) {
            logger.warn("Build {} of job {} disappeared, starting a new one", handle.getBuildName(), job.getKey());
            write(context, job, status.toBuilder()
                    .withBuildStatus(buildStatus.toBuilder().withPhase(BuildPhase.Pending).withBuildName("").withStartTime(0).build())
                    .withMessage("Build " + handle.getBuildName() + " not found, starting a new build")
                    .build()
            );
            return ReconcileResult.requeueNow();
        }

        BuildInfo info = observed.get();
        switch (info.getPhase()) {
            case Complete:
                String image = info.getImageReference().orElseGet(() -> strategy.getImage(handle).orElse(null));
                if (isEmpty(image)) {
                    throw ValidatorException.buildImageMissing(job.getName());
                }
                write(context, job, status.toBuilder()
                        .withPhase(JobPhase.BuildComplete)
                        .withBuildStatus(buildStatus.toBuilder()
                                .withPhase(BuildPhase.Complete)
                                .withImageReference(image)
                                .withMessage(info.getMessage())
                                .withCompletionTime(info.getCompletionTime() > 0 ? info.getCompletionTime() : now)
                                .build()
                        )
                        .withMessage("Image build completed: " + image)
                        .build()
                );
                return ReconcileResult.requeueNow();
            case Failed:
            case Cancelled:
                throw ValidatorException.buildFailed(handle.getBuildName(), info.getPhase() + (info.getMessage().isEmpty() ? "" : ": " + info.getMessage()));
            default:
                logger.debug("Build {} of job {} is {}", handle.getBuildName(), job.getKey(), info.getPhase());
                write(context, job, status.toBuilder()
                        .withBuildStatus(buildStatus.toBuilder().withPhase(info.getPhase()).withMessage(info.getMessage()).build())
                        .withMessage("Build " + handle.getBuildName() + " is " + info.getPhase())
                        .build()
                );
                return ReconcileResult.requeueAfter(Duration.ofMillis(configuration.getBuildPollIntervalMs()));
        }
    }

    private ReconcileResult startBuild(ReconcileContext context, ValidationJob job, BuildStrategy strategy, BuildStatus buildStatus) {
        BuildHandle handle = BuildHandle.of(job.getNamespace(), job.getName(), job.getUid(), job.getStatus().getRetryCount() + 1);
        BuildInfo info;
        Optional<BuildInfo> existing = strategy.getStatus(handle);
        if (existing.isPresent()) {
            logger.info("Adopting existing build {} of job {}", handle.getBuildName(), job.getKey());
            info = existing.get();
        } else {
            strategy.delete(handle);
            info = strategy.createBuild(handle, job.getSpec());
            metrics.buildCreated(strategy.getName());
            logger.info("Created build {} of job {} with strategy {}", handle.getBuildName(), job.getKey(), strategy.getName());
        }
        BuildPhase phase = info.getPhase() == BuildPhase.Complete ? BuildPhase.Running : info.getPhase();
        write(context, job, job.getStatus().toBuilder()
                .withBuildStatus(buildStatus.toBuilder()
                        .withPhase(phase)
                        .withBuildName(handle.getBuildName())
                        .withMessage(info.getMessage())
                        .withStartTime(clock.wallTime())
                        .withCompletionTime(0)
                        .build()
                )
                .withMessage("Build " + handle.getBuildName() + " started")
                .build()
        );
        return ReconcileResult.requeueAfter(Duration.ofMillis(configuration.getBuildPollIntervalMs()));
    }

    private ReconcileResult handleBuildComplete(ReconcileContext context, ValidationJob job) {
        Optional<BuildStatus> buildStatus = job.getStatus().getBuildStatus();
        if (!buildStatus.isPresent() || buildStatus.get().getPhase() != BuildPhase.Complete) {
            throw ValidatorException.buildImageMissing(job.getName());
        }
        write(context, job, job.getStatus().toBuilder()
                .withPhase(JobPhase.ValidationRunning)
                .withMessage("Starting validation with image " + buildStatus.get().getImageReference())
                .build()
        );
        return ReconcileResult.requeueNow();
    }

    private ReconcileResult handleValidationRunning(ReconcileContext context, ValidationJob job) {
        ValidationJobStatus status = job.getStatus();
        if (isEmpty(status.getValidationPodName())) {
            Optional<Duration> wait = remainingBackoff(status, clock.wallTime());
            if (wait.isPresent()) {
                logger.debug("Job {} waits {} before the next validation attempt", job.getKey(), DateTimeExt.toDurationString(wait.get().toMillis()));
                return ReconcileResult.requeueAfter(wait.get());
            }
        }

        boolean builtImage = status.getBuildStatus().map(b -> b.getPhase() == BuildPhase.Complete).orElse(false);
        String image = builtImage
                ? status.getBuildStatus().get().getImageReference()
                : job.getSpec().getPodConfig().getContainerImage();

        ExecutionOutcome outcome = orchestrator.execute(job, image, builtImage);
        switch (outcome.getState()) {
            case Succeeded:
                write(context, job, status.toBuilder()
                        .withPhase(JobPhase.Succeeded)
                        .withValidationPodName(outcome.getPodName())
                        .withResults(outcome.getResults())
                        .withMessage(outcome.getMessage())
                        .withReasonCode(ReasonCode.ValidationSucceeded)
                        .withCompletionTime(clock.wallTime())
                        .build()
                );
                return ReconcileResult.done();
            case Failed:
                ValidationJob withPod = job.toBuilder().withStatus(status.toBuilder().withValidationPodName(outcome.getPodName()).build()).build();
                return handleFailure(context, withPod, outcome.getError(), outcome.getResults());
            case Running:
            default:
                write(context, job, status.toBuilder()
                        .withValidationPodName(outcome.getPodName())
                        .withMessage(outcome.getMessage())
                        .build()
                );
                return ReconcileResult.requeueAfter(Duration.ofMillis(configuration.getPodPollIntervalMs()));
        }
    }

    /**
     * Classifies a handler failure and applies the retry decision. Terminal failures keep all resources for
     * inspection. Retriable failures delete the failed build or pod, so the next attempt starts clean.
     */
    private ReconcileResult handleFailure(ReconcileContext context, ValidationJob job, Throwable error, List<CellResult> results) {
        ValidationJobStatus status = job.getStatus();
        RetryDecision decision = retryClassifier.classify(error, status.getRetryCount(), configuration.getMaxRetries());
        metrics.retryClassified(decision.getClassification(), decision.getReasonCode());
        long now = clock.wallTime();

        ValidationJobStatus.Builder builder = status.toBuilder()
                .withRetryCount(decision.getNextRetryCount())
                .withMessage(decision.getMessage())
                .withReasonCode(decision.getReasonCode());
        if (decision.getNextRetryCount() != status.getRetryCount()) {
            builder.withLastRetryTime(now);
        }
        if (!results.isEmpty()) {
            builder.withResults(results);
        }

        JobPhase phase = status.getPhase();
        switch (decision.getClassification()) {
            case Terminal:
                logger.error("Job {} failed in phase {}: {}", job.getKey(), phase, decision.getMessage());
                if (phase == JobPhase.Building) {
                    status.getBuildStatus().ifPresent(buildStatus -> builder.withBuildStatus(buildStatus.toBuilder()
                            .withPhase(BuildPhase.Failed)
                            .withImageReference("")
                            .withMessage(decision.getMessage())
                            .withCompletionTime(now)
                            .build()
                    ));
                }
                write(context, job, builder.withPhase(JobPhase.Failed).withCompletionTime(now).build());
                return ReconcileResult.done();
            case Retriable:
                logger.warn("Job {} attempt {} failed in phase {}, retrying in {}: {}",
                        job.getKey(), status.getRetryCount() + 1, phase, DateTimeExt.toDurationString(decision.getDelay().toMillis()), decision.getMessage());
                if (phase == JobPhase.Building) {
                    status.getBuildStatus().ifPresent(buildStatus -> builder.withBuildStatus(buildStatus.toBuilder()
                            .withPhase(BuildPhase.Pending)
                            .withImageReference("")
                            .withBuildName("")
                            .withStartTime(0)
                            .withCompletionTime(0)
                            .build()
                    ));
                } else if (phase == JobPhase.ValidationRunning) {
                    builder.withValidationPodName("");
                }
                if (write(context, job, builder.build())) {
                    deleteFailedResources(job);
                }
                return ReconcileResult.requeueAfter(decision.getDelay());
            case Transient:
            default:
                logger.warn("Job {} hit a transient error in phase {}, retrying in {}: {}",
                        job.getKey(), phase, DateTimeExt.toDurationString(decision.getDelay().toMillis()), decision.getMessage());
                write(context, job, builder.build());
                return ReconcileResult.requeueAfter(decision.getDelay());
        }
    }

    /**
     * Resources left by a failed attempt are also removed before the next attempt creates new ones, so a failed
     * delete here only delays the cleanup.
     */
    private void deleteFailedResources(ValidationJob job) {
        try {
            if (job.getStatus().getPhase() == JobPhase.Building) {
                Optional<BuildStatus> buildStatus = job.getStatus().getBuildStatus();
                Optional<BuildHandle> handle = buildStatus.flatMap(b ->
                        BuildHandle.fromBuildName(job.getNamespace(), job.getName(), job.getUid(), b.getBuildName())
                );
                if (handle.isPresent()) {
                    strategyRegistry.getStrategy(buildStatus.get().getStrategy()).delete(handle.get());
                }
            } else if (job.getStatus().getPhase() == JobPhase.ValidationRunning) {
                orchestrator.deletePods(job);
            }
        } catch (KubeApiException e) {
            logger.warn("Cannot delete the failed resources of job {}; they will be removed before the next attempt: {}", job.getKey(), e.getMessage());
        }
    }

    private Optional<Duration> remainingBackoff(ValidationJobStatus status, long now) {
        if (status.getRetryCount() == 0 || status.getLastRetryTime() == 0) {
            return Optional.empty();
        }
        long eligibleAt = status.getLastRetryTime() + backoffSchedule.delayFor(status.getRetryCount()).toMillis();
        return eligibleAt > now ? Optional.of(Duration.ofMillis(eligibleAt - now)) : Optional.empty();
    }

    /**
     * @return true if the status was written
     */
    private boolean write(ReconcileContext context, ValidationJob job, ValidationJobStatus status) {
        if (context.isCancelled()) {
            logger.info("Reconcile of job {} cancelled, status update dropped", job.getKey());
            return false;
        }
        statusUpdater.update(job, status);
        return true;
    }

    /**
     * A missing serving platform is recorded but does not fail the job. The notebook decides what to do without it.
     */
    private ModelValidationResult checkServingPlatform(ValidationJob job, ClusterCapabilities capabilities) {
        String platform = job.getSpec().getModelValidation().getPlatform();
        if (capabilities.isServingPlatformAvailable(platform)) {
            logger.info("Job {} uses model serving platform {}", job.getKey(), platform);
            return new ModelValidationResult(platform, true, "Platform " + platform + " detected in the cluster");
        }
        logger.warn("Job {} requested model serving platform {}, which is not installed (found: {}); continuing without it",
                job.getKey(), platform, capabilities.getServingPlatforms());
        return new ModelValidationResult(platform, false, "Platform " + platform + " not available in the cluster");
    }

    private void validateSpec(ValidationJobSpec spec, String namespace) {
        if (isEmpty(spec.getNotebook().getGitUrl())) {
            throw ValidatorException.configurationInvalid("notebook.git.url is required");
        }
        if (isEmpty(spec.getNotebook().getPath()) || !spec.getNotebook().getPath().endsWith(".ipynb")) {
            throw ValidatorException.configurationInvalid("notebook.path must name an .ipynb file, got '" + spec.getNotebook().getPath() + "'");
        }
        if (!DateTimeExt.parseDuration(jobTimeoutOf(spec)).isPresent()) {
            throw ValidatorException.configurationInvalid("timeout '" + spec.getTimeout() + "' is not a valid duration");
        }
        if (spec.isBuildEnabled()) {
            BuildConfig buildConfig = spec.getBuildConfig();
            if (!DateTimeExt.parseDuration(buildTimeoutOf(buildConfig)).isPresent()) {
                throw ValidatorException.configurationInvalid("buildConfig.timeout '" + buildConfig.getTimeout() + "' is not a valid duration");
            }
        } else if (isEmpty(spec.getPodConfig().getContainerImage())) {
            throw ValidatorException.configurationInvalid("podConfig.containerImage is required when the image build is disabled");
        }
        ModelValidationConfig modelValidation = spec.getModelValidation();
        if (modelValidation.isEnabled()) {
            if (!MODEL_VALIDATION_PHASES.contains(modelValidation.getPhase())) {
                throw ValidatorException.configurationInvalid("modelValidation.phase must be one of " + MODEL_VALIDATION_PHASES
                        + ", got '" + modelValidation.getPhase() + "'");
            }
            if (!DateTimeExt.parseDuration(modelValidation.getTimeout()).isPresent()) {
                throw ValidatorException.configurationInvalid("modelValidation.timeout '" + modelValidation.getTimeout() + "' is not a valid duration");
            }
            for (String model : modelValidation.getTargetModels()) {
                int separator = model.indexOf('/');
                if (separator >= 0 && !model.substring(0, separator).equals(namespace)) {
                    throw ValidatorException.configurationInvalid("modelValidation.targetModels entry '" + model
                            + "' is outside the job namespace " + namespace);
                }
            }
        }
    }

    private boolean isJobTimedOut(ValidationJob job) {
        long startTime = job.getStatus().getStartTime();
        return startTime > 0 && clock.elapsedSince(startTime) > parseTimeout(jobTimeoutOf(job.getSpec()), configuration.getDefaultJobTimeout());
    }

    private String jobTimeoutOf(ValidationJobSpec spec) {
        return isNotEmpty(spec.getTimeout()) ? spec.getTimeout() : configuration.getDefaultJobTimeout();
    }

    private String buildTimeoutOf(BuildConfig config) {
        return isNotEmpty(config.getTimeout()) ? config.getTimeout() : configuration.getDefaultBuildTimeout();
    }

    private static long parseTimeout(String value, String defaultValue) {
        return DateTimeExt.parseDuration(value)
                .orElseGet(() -> DateTimeExt.parseDuration(defaultValue).orElse(Duration.ofMinutes(30)))
                .toMillis();
    }
}
