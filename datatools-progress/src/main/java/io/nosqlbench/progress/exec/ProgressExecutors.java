/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.progress.exec;

import io.nosqlbench.progress.MultiProgressCoordinator;
import io.nosqlbench.progress.WorkerHandle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs one task per worker of a {@link MultiProgressCoordinator} on an executor, wiring each
 * task to its worker's handle.
 *
 * <p>When a task returns, its worker is finished, so a task that reports fewer steps than its
 * length still lets the display complete. When a task throws, its worker is cancelled and the
 * exception completes the returned future.
 *
 * <pre>{@code
 * ExecutorService pool = Executors.newFixedThreadPool(4);
 * try (MultiProgressCoordinator progress = MultiProgressCoordinator.create(files.size(), 100, shared)) {
 *     ProgressExecutors.runAll(progress, pool, handle -> copy(files.get(handle.getWorkerId() - 1), handle)).join();
 *     progress.awaitCompletion();
 * }
 * }</pre>
 */
public final class ProgressExecutors {

    private static final Logger logger = LogManager.getLogger(ProgressExecutors.class);

    private ProgressExecutors() {
    }

    /**
     * Submits {@code task} once for every worker of the coordinator.
     *
     * @param coordinator supplies one handle per worker
     * @param executor runs the tasks
     * @param task the work, called with each worker's handle
     * @return a future that completes when every task has returned, or exceptionally with the
     *         first task failure
     */
    public static CompletableFuture<Void> runAll(MultiProgressCoordinator coordinator, Executor executor, WorkerTask task) {
        Objects.requireNonNull(coordinator, "coordinator");
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(task, "task");

        List<CompletableFuture<Void>> futures = new ArrayList<>(coordinator.getAmount());
        for (WorkerHandle handle : coordinator.workers()) {
            futures.add(CompletableFuture.runAsync(() -> runWorker(task, handle), executor));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
    }

    /**
     * Submits one task per worker, in worker id order.
     *
     * @param coordinator supplies one handle per worker
     * @param executor runs the tasks
     * @param tasks one task per worker
     * @return a future that completes when every task has returned
     * @throws IllegalArgumentException if the number of tasks differs from the number of workers
     */
    public static CompletableFuture<Void> runEach(MultiProgressCoordinator coordinator, Executor executor, List<? extends WorkerTask> tasks) {
        Objects.requireNonNull(tasks, "tasks");
        if (tasks.size() != coordinator.getAmount()) {
            throw new IllegalArgumentException("Got " + tasks.size() + " tasks for " + coordinator.getAmount() + " workers");
        }
        List<CompletableFuture<Void>> futures = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            WorkerTask task = Objects.requireNonNull(tasks.get(i), "task");
            WorkerHandle handle = coordinator.worker(i + 1);
            futures.add(CompletableFuture.runAsync(() -> runWorker(task, handle), executor));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
    }

    private static void runWorker(WorkerTask task, WorkerHandle handle) {
        try {
            task.run(handle);
        } catch (InterruptedException e) {
            cancelWhileInterrupted(handle);
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        } catch (Exception e) {
            logger.debug("Task for worker {} failed: {}", handle.getWorkerId(), e.getMessage());
            cancelWhileInterrupted(handle);
            throw new CompletionException(e);
        }
        handle.finish();
    }

    /**
     * Sends a cancel even if the current thread is interrupted. The channel refuses sends from an
     * interrupted thread, so the flag is cleared for the send and set again afterwards.
     */
    private static void cancelWhileInterrupted(WorkerHandle handle) {
        boolean interrupted = Thread.interrupted();
        try {
            handle.cancel();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
