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
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import com.jayway.awaitility.Awaitility;
import com.jayway.awaitility.core.ConditionFactory;
import io.mlops.validator.api.model.JobKey;
import io.mlops.validator.common.runtime.ValidatorRuntimes;
import io.mlops.validator.server.reconciler.ReconcileContext;
import io.mlops.validator.server.reconciler.ReconcileResult;
import org.junit.After;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class DefaultJobWorkQueueTest {

    private static final JobKey JOB_A = JobKey.of("ml-team", "churn");
    private static final JobKey JOB_B = JobKey.of("ml-team", "forecast");

    private final Map<JobKey, AtomicInteger> invocations = new ConcurrentHashMap<>();
    private final List<ReconcileContext> contexts = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    private DefaultJobWorkQueue workQueue;

    @After
    public void tearDown() {
        if (workQueue != null) {
            workQueue.shutdown();
        }
    }

    @Test
    public void testReconcileRunsAndCompletes() {
        newWorkQueue(1, context -> ReconcileResult.done());

        workQueue.enqueue(JOB_A);

        await().until(() -> invocationsOf(JOB_A) == 1 && workQueue.size() == 0);
    }

    @Test
    public void testQueuedRequestsAreCoalesced() throws Exception {
        CountDownLatch blockerStarted = new CountDownLatch(1);
        CountDownLatch releaseBlocker = new CountDownLatch(1);
        newWorkQueue(1, context -> {
            if (context.getKey().equals(JOB_B)) {
                blockerStarted.countDown();
                awaitUninterruptibly(releaseBlocker);
            }
            return ReconcileResult.done();
        });

        // JOB_B holds the only worker, so JOB_A stays queued.
        workQueue.enqueue(JOB_B);
        assertThat(blockerStarted.await(5, TimeUnit.SECONDS)).isTrue();
        workQueue.enqueue(JOB_A);
        workQueue.enqueue(JOB_A);
        workQueue.enqueue(JOB_A);
        releaseBlocker.countDown();

        await().until(() -> workQueue.size() == 0);
        assertThat(invocationsOf(JOB_A)).isEqualTo(1);
    }

    @Test
    public void testEnqueueWhileRunningTriggersSingleRerun() throws Exception {
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        newWorkQueue(4, context -> {
            if (invocationsOf(JOB_A) == 1) {
                firstStarted.countDown();
                awaitUninterruptibly(releaseFirst);
            }
            return ReconcileResult.done();
        });

        workQueue.enqueue(JOB_A);
        assertThat(firstStarted.await(5, TimeUnit.SECONDS)).isTrue();
        workQueue.enqueue(JOB_A);
        workQueue.enqueue(JOB_A);
        releaseFirst.countDown();

        await().until(() -> workQueue.size() == 0);
        assertThat(invocationsOf(JOB_A)).isEqualTo(2);
        assertThat(maxInFlight.get()).isEqualTo(1);
    }

    @Test
    public void testRequeueAfterDelay() {
        newWorkQueue(1, context -> invocationsOf(JOB_A) == 1 ? ReconcileResult.requeueAfter(Duration.ofMillis(50)) : ReconcileResult.done());

        workQueue.enqueue(JOB_A);

        await().until(() -> invocationsOf(JOB_A) == 2 && workQueue.size() == 0);
    }

    @Test
    public void testRequeueNow() {
        newWorkQueue(1, context -> invocationsOf(JOB_A) < 3 ? ReconcileResult.requeueNow() : ReconcileResult.done());

        workQueue.enqueue(JOB_A);

        await().until(() -> invocationsOf(JOB_A) == 3 && workQueue.size() == 0);
    }

    @Test
    public void testEarliestDelayedRequestWins() {
        newWorkQueue(1, context -> ReconcileResult.done());

        workQueue.enqueueAfter(JOB_A, Duration.ofHours(1));
        workQueue.enqueueAfter(JOB_A, Duration.ofMillis(20));
        workQueue.enqueueAfter(JOB_A, Duration.ofHours(2));

        await().until(() -> invocationsOf(JOB_A) == 1 && workQueue.size() == 0);
    }

    @Test
    public void testImmediateRequestReplacesDelayedOne() {
        newWorkQueue(1, context -> ReconcileResult.done());

        workQueue.enqueueAfter(JOB_A, Duration.ofHours(1));
        assertThat(workQueue.size()).isEqualTo(1);
        workQueue.enqueue(JOB_A);

        await().until(() -> invocationsOf(JOB_A) == 1 && workQueue.size() == 0);
    }

    @Test
    public void testCancelStopsRunningReconcile() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        newWorkQueue(1, context -> {
            started.countDown();
            awaitUninterruptibly(release);
            return ReconcileResult.requeueNow();
        });

        workQueue.enqueue(JOB_A);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        workQueue.cancel(JOB_A);
        release.countDown();

        await().until(() -> inFlight.get() == 0 && workQueue.size() == 0);
        assertThat(contexts.get(0).isCancelled()).isTrue();
        assertThat(invocationsOf(JOB_A)).isEqualTo(1);
    }

    @Test
    public void testEnqueueAfterCancelWaitsForCancelledReconcile() throws Exception {
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        newWorkQueue(4, context -> {
            if (invocationsOf(JOB_A) == 1) {
                firstStarted.countDown();
                awaitUninterruptibly(releaseFirst);
            }
            return ReconcileResult.done();
        });

        workQueue.enqueue(JOB_A);
        assertThat(firstStarted.await(5, TimeUnit.SECONDS)).isTrue();
        workQueue.cancel(JOB_A);
        workQueue.enqueue(JOB_A);

        // Give a wrongly started second reconcile the chance to run.
        Thread.sleep(100);
        assertThat(invocationsOf(JOB_A)).isEqualTo(1);
        releaseFirst.countDown();

        await().until(() -> invocationsOf(JOB_A) == 2 && workQueue.size() == 0);
        assertThat(contexts.get(0).isCancelled()).isTrue();
        assertThat(contexts.get(1).isCancelled()).isFalse();
        assertThat(maxInFlight.get()).isEqualTo(1);
    }

    @Test
    public void testCancelOfQueuedRequestDropsIt() throws Exception {
        CountDownLatch blockerStarted = new CountDownLatch(1);
        CountDownLatch releaseBlocker = new CountDownLatch(1);
        newWorkQueue(1, context -> {
            if (context.getKey().equals(JOB_B)) {
                blockerStarted.countDown();
                awaitUninterruptibly(releaseBlocker);
            }
            return ReconcileResult.done();
        });

        workQueue.enqueue(JOB_B);
        assertThat(blockerStarted.await(5, TimeUnit.SECONDS)).isTrue();
        workQueue.enqueue(JOB_A);
        workQueue.cancel(JOB_A);
        releaseBlocker.countDown();

        await().until(() -> workQueue.size() == 0 && inFlight.get() == 0);
        assertThat(invocationsOf(JOB_A)).isZero();
    }

    @Test
    public void testUnexpectedErrorIsRetried() {
        newWorkQueue(1, context -> {
            if (invocationsOf(JOB_A) == 1) {
                throw new IllegalStateException("simulated reconcile bug");
            }
            return ReconcileResult.done();
        });

        workQueue.enqueue(JOB_A);

        await().until(() -> invocationsOf(JOB_A) == 2 && workQueue.size() == 0);
    }

    @Test
    public void testNoWorkAfterShutdown() {
        newWorkQueue(1, context -> ReconcileResult.done());

        workQueue.shutdown();
        workQueue.enqueue(JOB_A);
        workQueue.enqueueAfter(JOB_B, Duration.ofMillis(1));

        assertThat(workQueue.size()).isZero();
        assertThat(invocationsOf(JOB_A)).isZero();
    }

    private void newWorkQueue(int workers, Function<ReconcileContext, ReconcileResult> reconciler) {
        Function<ReconcileContext, ReconcileResult> tracking = context -> {
            contexts.add(context);
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            invocations.computeIfAbsent(context.getKey(), k -> new AtomicInteger()).incrementAndGet();
            try {
                return reconciler.apply(context);
            } finally {
                inFlight.decrementAndGet();
            }
        };
        workQueue = new DefaultJobWorkQueue(
                tracking,
                Executors.newFixedThreadPool(workers),
                Executors.newSingleThreadScheduledExecutor(),
                Duration.ofMillis(10),
                1_000,
                ValidatorRuntimes.test()
        );
    }

    private int invocationsOf(JobKey key) {
        AtomicInteger counter = invocations.get(key);
        return counter == null ? 0 : counter.get();
    }

    private static void awaitUninterruptibly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ConditionFactory await() {
        return Awaitility.await().timeout(5, TimeUnit.SECONDS);
    }
}
