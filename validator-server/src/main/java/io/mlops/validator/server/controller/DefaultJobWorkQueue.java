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

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import com.google.common.annotations.VisibleForTesting;
import com.netflix.spectator.api.Registry;
import com.netflix.spectator.api.patterns.PolledMeter;
import io.mlops.validator.api.model.JobKey;
import io.mlops.validator.common.runtime.ValidatorRuntime;
import io.mlops.validator.common.util.ExecutorsExt;
import io.mlops.validator.common.util.time.Clock;
import io.mlops.validator.server.metrics.MetricConstants;
import io.mlops.validator.server.reconciler.ReconcileContext;
import io.mlops.validator.server.reconciler.ReconcileResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link JobWorkQueue} backed by a fixed worker pool and a single scheduler thread for delayed requests. All
 * bookkeeping is guarded by the queue monitor; reconciles run outside of it.
 */
public class DefaultJobWorkQueue implements JobWorkQueue {

    private static final Logger logger = LoggerFactory.getLogger(DefaultJobWorkQueue.class);

    private static final String WORKER_POOL_NAME = "validator-reconciler";

    private final Function<ReconcileContext, ReconcileResult> reconcileFunction;
    private final Duration errorRequeueDelay;
    private final long shutdownTimeoutMs;
    private final Clock clock;

    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;

    private final Map<JobKey, Entry> entries = new HashMap<>();
    private boolean shutdown;

    public DefaultJobWorkQueue(Function<ReconcileContext, ReconcileResult> reconcileFunction,
                               ValidatorControllerConfiguration configuration,
                               ValidatorRuntime runtime) {
        this(
                reconcileFunction,
                ExecutorsExt.instrumentedFixedSizeThreadPool(runtime.getRegistry(), WORKER_POOL_NAME, configuration.getWorkerCount()),
                ExecutorsExt.namedSingleThreadScheduledExecutor(WORKER_POOL_NAME + "-scheduler"),
                Duration.ofMillis(configuration.getErrorRequeueDelayMs()),
                configuration.getShutdownTimeoutMs(),
                runtime
        );
    }

    @VisibleForTesting
    DefaultJobWorkQueue(Function<ReconcileContext, ReconcileResult> reconcileFunction,
                        ExecutorService workers,
                        ScheduledExecutorService scheduler,
                        Duration errorRequeueDelay,
                        long shutdownTimeoutMs,
                        ValidatorRuntime runtime) {
        this.reconcileFunction = reconcileFunction;
        this.workers = workers;
        this.scheduler = scheduler;
        this.errorRequeueDelay = errorRequeueDelay;
        this.shutdownTimeoutMs = shutdownTimeoutMs;
        this.clock = runtime.getClock();

        Registry registry = runtime.getRegistry();
        PolledMeter.using(registry)
                .withName(MetricConstants.METRIC_CONTROLLER + "workQueueSize")
                .monitorValue(this, DefaultJobWorkQueue::size);
    }

    @Override
    public void enqueue(JobKey key) {
        synchronized (this) {
            if (shutdown) {
                return;
            }
            Entry entry = entries.computeIfAbsent(key, k -> new Entry());
            entry.cancelDelayed();
            if (entry.running != null) {
                entry.rerun = true;
                return;
            }
            if (entry.queued) {
                return;
            }
            entry.queued = true;
            submit(key, entry);
        }
    }

    @Override
    public void enqueueAfter(JobKey key, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            enqueue(key);
            return;
        }
        synchronized (this) {
            if (shutdown) {
                return;
            }
            Entry entry = entries.computeIfAbsent(key, k -> new Entry());
            if (entry.queued || entry.rerun) {
                return;
            }
            long dueAt = clock.wallTime() + delay.toMillis();
            if (entry.delayed != null && entry.delayedDueAt <= dueAt) {
                return;
            }
            entry.cancelDelayed();
            entry.delayedDueAt = dueAt;
            entry.delayed = scheduler.schedule(() -> onDelayExpired(key, entry), delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /**
     * A running reconcile keeps its entry until it returns, so that a request made in the meantime waits for it
     * instead of starting a second reconcile of the same job.
     */
    @Override
    public void cancel(JobKey key) {
        synchronized (this) {
            Entry entry = entries.get(key);
            if (entry == null) {
                return;
            }
            entry.cancelDelayed();
            entry.queued = false;
            entry.rerun = false;
            if (entry.running == null) {
                entries.remove(key);
                return;
            }
            logger.info("Cancelling the running reconcile of job {}", key);
            entry.running.cancel();
        }
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    @Override
    public void shutdown() {
        synchronized (this) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            entries.values().forEach(entry -> {
                entry.cancelDelayed();
                if (entry.running != null) {
                    entry.running.cancel();
                }
            });
            entries.clear();
        }
        scheduler.shutdownNow();
        if (!ExecutorsExt.shutdownAndAwait(workers, shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
            logger.warn("Reconcile workers did not terminate within {}ms", shutdownTimeoutMs);
        }
    }

    private void onDelayExpired(JobKey key, Entry entry) {
        synchronized (this) {
            if (entries.get(key) != entry) {
                return;
            }
            entry.delayed = null;
        }
        enqueue(key);
    }

    private void submit(JobKey key, Entry entry) {
        try {
            workers.execute(() -> run(key, entry));
        } catch (RejectedExecutionException e) {
            logger.warn("Reconcile of job {} rejected by the worker pool: {}", key, e.getMessage());
            entries.remove(key);
        }
    }

    private void run(JobKey key, Entry entry) {
        ReconcileContext context;
        synchronized (this) {
            if (shutdown || entries.get(key) != entry) {
                return;
            }
            entry.queued = false;
            context = new ReconcileContext(key);
            entry.running = context;
        }

        ReconcileResult result;
        try {
            result = reconcileFunction.apply(context);
        } catch (RuntimeException e) {
            logger.error("Unexpected error while reconciling job {}; retrying in {}", key, errorRequeueDelay, e);
            result = ReconcileResult.requeueAfter(errorRequeueDelay);
        }

        synchronized (this) {
            entry.running = null;
            if (shutdown || entries.get(key) != entry) {
                return;
            }
            if (context.isCancelled()) {
                if (entry.rerun) {
                    entry.rerun = false;
                    entry.queued = true;
                    submit(key, entry);
                } else if (entry.delayed == null) {
                    entries.remove(key);
                }
                return;
            }
            if (entry.rerun) {
                entry.rerun = false;
                entry.queued = true;
                submit(key, entry);
                return;
            }
            switch (result.getAction()) {
                case RequeueNow:
                    entry.queued = true;
                    submit(key, entry);
                    break;
                case RequeueAfter:
                    enqueueAfter(key, result.getDelay());
                    break;
                case Done:
                default:
                    if (entry.delayed == null) {
                        entries.remove(key);
                    }
            }
        }
    }

    private static class Entry {

        private boolean queued;
        private boolean rerun;
        private ReconcileContext running;
        private ScheduledFuture<?> delayed;
        private long delayedDueAt;

        private void cancelDelayed() {
            if (delayed != null) {
                delayed.cancel(false);
                delayed = null;
            }
        }
    }
}
