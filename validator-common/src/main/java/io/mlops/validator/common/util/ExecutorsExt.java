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

package io.mlops.validator.common.util;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.netflix.spectator.api.Registry;
import com.netflix.spectator.api.patterns.ThreadPoolMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread pools of the controller. All threads are named daemons, and an exception escaping a task is logged.
 */
public final class ExecutorsExt {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorsExt.class);

    private ExecutorsExt() {
    }

    /**
     * Pool with a fixed number of threads and an unbounded queue, reported by Spectator under the pool name.
     */
    public static ExecutorService instrumentedFixedSizeThreadPool(Registry registry, String name, int size) {
        Preconditions.checkArgument(size > 0, "Thread pool %s needs at least one thread, got %s", name, size);
        // ThreadPoolMonitor needs the concrete ThreadPoolExecutor type.
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                size, size,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                newThreadFactory(name + "-%d")
        );
        ThreadPoolMonitor.attach(registry, executor, name);
        return executor;
    }

    public static ScheduledExecutorService namedSingleThreadScheduledExecutor(String name) {
        return Executors.newSingleThreadScheduledExecutor(newThreadFactory(name));
    }

    /**
     * Drops the queued tasks, interrupts the running ones, and waits for them to finish.
     *
     * @return false if a task was still running when the timeout expired
     */
    public static boolean shutdownAndAwait(ExecutorService executor, long timeout, TimeUnit timeUnit) {
        List<Runnable> dropped = executor.shutdownNow();
        if (!dropped.isEmpty()) {
            logger.debug("Dropped {} queued tasks on shutdown", dropped.size());
        }
        try {
            return executor.awaitTermination(timeout, timeUnit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for the executor to terminate");
            return false;
        }
    }

    private static ThreadFactory newThreadFactory(String nameFormat) {
        return new ThreadFactoryBuilder()
                .setNameFormat(nameFormat)
                .setDaemon(true)
                .setUncaughtExceptionHandler((thread, error) -> logger.error("Uncaught exception in thread {}", thread.getName(), error))
                .build();
    }
}
