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

/**
 * Coordinates progress bars that are advanced by many concurrent workers and shown on one
 * terminal.
 *
 * <h2>Design</h2>
 * <p>Workers never touch a bar. They send small immutable messages (next, set value, finish,
 * cancel) on a channel, and a single consumer thread per coordinator applies them. Because only
 * that thread mutates display state, none of it is locked, and output from different bars cannot
 * interleave.
 *
 * <h2>Primary Components</h2>
 * <ul>
 *   <li><strong>{@link io.nosqlbench.progress.MultiProgressCoordinator}</strong> - one bar per
 *       worker plus an aggregate bar; worker bars get terminal lines lazily and give them back
 *       when done</li>
 *   <li><strong>{@link io.nosqlbench.progress.WorkerHandle}</strong> - what a worker holds: a
 *       {@link io.nosqlbench.progress.ProgressReporter} tagged with the worker's id</li>
 *   <li><strong>{@link io.nosqlbench.progress.SingleProgressCoordinator}</strong> - one bar
 *       driven from many threads</li>
 *   <li><strong>{@link io.nosqlbench.progress.ProgressTracker}</strong> and
 *       {@link io.nosqlbench.progress.ProgressRenderer} - the bar primitive and its factory;
 *       implementations live in {@code io.nosqlbench.progress.render}</li>
 *   <li><strong>{@link io.nosqlbench.progress.ProgressConfig}</strong> - description, color,
 *       enabled flag and output stream, shared or per worker</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * List<ProgressConfig> perTask = new ArrayList<>();
 * for (int i = 1; i <= 5; i++) {
 *     perTask.add(ProgressConfig.builder().description("task " + i + " ").build());
 * }
 * try (MultiProgressCoordinator progress = MultiProgressCoordinator.builder(10, 10, 10, 10, 10)
 *         .shared(ProgressConfig.builder().description("global ").build())
 *         .perWorker(perTask)
 *         .build()) {
 *     ProgressExecutors.runAll(progress, pool, handle -> {
 *         for (int i = 0; i < 10; i++) {
 *             step();
 *             handle.next();
 *         }
 *     }).join();
 *     progress.awaitCompletion();
 * }
 * }</pre>
 *
 * <h2>Limits</h2>
 * <p>A worker that stops reporting before reaching its length holds its line until it is
 * finished or cancelled. Nothing times it out.
 *
 * @see io.nosqlbench.progress.eventing.UpdateChannel
 */
package io.nosqlbench.progress;
