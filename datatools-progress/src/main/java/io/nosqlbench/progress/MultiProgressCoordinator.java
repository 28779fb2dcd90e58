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

package io.nosqlbench.progress;

import io.nosqlbench.progress.eventing.BlockingUpdateChannel;
import io.nosqlbench.progress.eventing.UpdateChannel;
import io.nosqlbench.progress.eventing.WorkerMessage;
import io.nosqlbench.progress.render.ProgressRenderers;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shows one progress bar per worker plus an aggregate bar, fed by any number of concurrent
 * workers through a single shared channel.
 *
 * <p>Each worker gets a {@link WorkerHandle} from {@link #worker(int)}. Handles only enqueue
 * messages; one consumer thread owns every bar and applies the messages in arrival order. A
 * worker's bar appears on the first free line when its first message arrives, and the line is
 * given back when the worker reaches its length or is cancelled, so the display is only as tall
 * as the number of workers active at once.
 *
 * <p>The display completes when every worker has finished or been cancelled. After that the
 * coordinator is inert: further updates are dropped.
 *
 * <p>Worker ids run from 1 to {@link #getAmount()}.
 *
 * <pre>{@code
 * try (MultiProgressCoordinator progress = MultiProgressCoordinator.builder(10, 10, 10, 10, 10)
 *         .shared(ProgressConfig.builder().description("global ").build())
 *         .perWorker(descriptions)
 *         .build()) {
 *     ExecutorService pool = Executors.newFixedThreadPool(2);
 *     for (int id = 1; id <= progress.getAmount(); id++) {
 *         WorkerHandle handle = progress.worker(id);
 *         pool.submit(() -> {
 *             for (int i = 0; i < 10; i++) {
 *                 doStep();
 *                 handle.next();
 *             }
 *         });
 *     }
 *     progress.awaitCompletion();
 *     pool.shutdown();
 * }
 * }</pre>
 *
 * <p>A worker that stops sending before it reaches its length keeps its line, and the display
 * never completes, until someone finishes or cancels it. There are no timeouts.
 */
public class MultiProgressCoordinator implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(MultiProgressCoordinator.class);

    private static final int MIN_CHANNEL_CAPACITY = 64;
    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private final long[] lengths;
    private final CoordinatorState state;
    private final List<WorkerHandle> handles;
    private final ConsumerLoop<WorkerMessage> loop;

    private MultiProgressCoordinator(Builder builder) {
        this.lengths = builder.lengths.clone();
        ProgressConfig shared = builder.shared;
        List<ProgressConfig> perWorker = builder.perWorker != null
            ? builder.perWorker
            : Collections.nCopies(lengths.length, ProgressConfig.empty());
        ProgressRenderer renderer = builder.renderer != null ? builder.renderer : ProgressRenderers.fromSystemProperty();
        UpdateChannel<WorkerMessage> channel = builder.channel != null
            ? builder.channel
            : new BlockingUpdateChannel<>(Math.max(2 * lengths.length, MIN_CHANNEL_CAPACITY));
        String name = builder.name != null ? builder.name : "MultiProgress-" + SEQUENCE.incrementAndGet();

        this.state = new CoordinatorState(lengths, shared, perWorker, renderer);

        List<WorkerHandle> workerHandles = new ArrayList<>(lengths.length);
        for (int i = 0; i < lengths.length; i++) {
            workerHandles.add(new WorkerHandle(channel, i + 1, lengths[i]));
        }
        this.handles = Collections.unmodifiableList(workerHandles);

        this.loop = new ConsumerLoop<>(name, channel, state::apply);
        if (state.isTerminated()) {
            logger.debug("{} has no work to display", name);
            loop.completeWithoutStarting();
        } else {
            loop.start();
        }
    }

    /**
     * Creates a coordinator for {@code workerCount} workers of the same length.
     *
     * @param workerCount the number of workers
     * @param uniformLength each worker's total
     * @param shared configuration for every bar
     * @return a running coordinator
     */
    public static MultiProgressCoordinator create(int workerCount, long uniformLength, ProgressConfig shared) {
        if (workerCount < 0) {
            throw new IllegalArgumentException("Worker count must be non-negative, got " + workerCount);
        }
        long[] lengths = new long[workerCount];
        Arrays.fill(lengths, uniformLength);
        return builder(lengths).shared(shared).build();
    }

    /**
     * Creates a coordinator with one worker per length.
     *
     * @param lengths each worker's total, in worker id order
     * @param shared configuration for every bar
     * @param perWorker per-worker overrides, one per length
     * @return a running coordinator
     * @throws IllegalArgumentException if the number of overrides differs from the number of lengths
     */
    public static MultiProgressCoordinator create(long[] lengths, ProgressConfig shared, List<ProgressConfig> perWorker) {
        return builder(lengths).shared(shared).perWorker(perWorker).build();
    }

    public static Builder builder(long... lengths) {
        return new Builder(lengths);
    }

    /**
     * Returns the handle for one worker.
     *
     * @param workerId the worker's id, from 1 to {@link #getAmount()}
     * @return the worker's handle
     * @throws IndexOutOfBoundsException if the id was not declared
     */
    public WorkerHandle worker(int workerId) {
        if (workerId < 1 || workerId > handles.size()) {
            throw new IndexOutOfBoundsException("Worker id " + workerId + " is outside [1, " + handles.size() + "]");
        }
        return handles.get(workerId - 1);
    }

    /**
     * @return every worker handle, in id order
     */
    public List<WorkerHandle> workers() {
        return handles;
    }

    public int getAmount() {
        return lengths.length;
    }

    public long getLength(int workerId) {
        return worker(workerId).getLength();
    }

    /**
     * @return the sum of all worker lengths
     */
    public long getTotal() {
        return state.getAggregate().getTotal();
    }

    /**
     * @return the aggregate bar; its count may be read from any thread as a snapshot
     */
    public ProgressTracker getAggregate() {
        return state.getAggregate();
    }

    /**
     * Sends a finish to every worker.
     */
    public void finish() {
        for (WorkerHandle handle : handles) {
            handle.finish();
        }
    }

    /**
     * Sends a cancel to every worker.
     */
    public void cancel() {
        for (WorkerHandle handle : handles) {
            handle.cancel();
        }
    }

    /**
     * @return {@code true} once the consumer thread has stopped
     */
    public boolean isComplete() {
        return loop.isDone();
    }

    /**
     * Waits until every worker has finished or been cancelled and the display is complete.
     *
     * @throws ProgressException if the consumer stopped on a failure, such as a message for an
     *                           undeclared worker, or the caller was interrupted
     */
    public void awaitCompletion() {
        loop.await();
    }

    /**
     * @param timeout how long to wait
     * @return {@code true} if the display completed in time
     * @throws ProgressException if the consumer stopped on a failure or the caller was interrupted
     */
    public boolean awaitCompletion(Duration timeout) {
        return loop.await(timeout);
    }

    /**
     * Cancels whatever is still running and waits for the display to complete.
     */
    @Override
    public void close() {
        if (!loop.isDone()) {
            cancel();
        }
        loop.await();
    }

    CoordinatorState state() {
        return state;
    }

    @Override
    public String toString() {
        return loop.getName() + "[" + getAmount() + " workers, " + getAggregate().getCount() + "/" + getTotal() + "]";
    }

    public static final class Builder {
        private final long[] lengths;
        private ProgressConfig shared = ProgressConfig.empty();
        private List<ProgressConfig> perWorker;
        private ProgressRenderer renderer;
        private UpdateChannel<WorkerMessage> channel;
        private String name;

        private Builder(long[] lengths) {
            this.lengths = Objects.requireNonNull(lengths, "lengths");
        }

        /**
         * @param shared configuration applied to the aggregate and every worker bar
         */
        public Builder shared(ProgressConfig shared) {
            this.shared = Objects.requireNonNull(shared, "shared");
            return this;
        }

        /**
         * @param perWorker overrides for each worker bar, one per length, in worker id order
         */
        public Builder perWorker(List<ProgressConfig> perWorker) {
            Objects.requireNonNull(perWorker, "perWorker");
            List<ProgressConfig> copy = new ArrayList<>(perWorker.size());
            for (ProgressConfig config : perWorker) {
                copy.add(config == null ? ProgressConfig.empty() : config);
            }
            this.perWorker = copy;
            return this;
        }

        /**
         * @param renderer builds the bars; defaults to the one selected by {@code nb.progress.display}
         */
        public Builder renderer(ProgressRenderer renderer) {
            this.renderer = Objects.requireNonNull(renderer, "renderer");
            return this;
        }

        /**
         * @param channel the transport from worker handles to the consumer thread; defaults to a
         *                bounded in-process channel
         */
        public Builder channel(UpdateChannel<WorkerMessage> channel) {
            this.channel = Objects.requireNonNull(channel, "channel");
            return this;
        }

        /**
         * @param name names the consumer thread and log messages
         */
        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        /**
         * Validates the configuration and starts the consumer thread. Nothing is drawn if
         * validation fails.
         *
         * @return a running coordinator
         * @throws IllegalArgumentException if a length is negative or the overrides do not match the lengths
         */
        public MultiProgressCoordinator build() {
            if (perWorker != null && perWorker.size() != lengths.length) {
                throw new IllegalArgumentException("Got " + lengths.length + " lengths but "
                    + perWorker.size() + " per-worker configurations");
            }
            for (int i = 0; i < lengths.length; i++) {
                if (lengths[i] < 0) {
                    throw new IllegalArgumentException("Length of worker " + (i + 1) + " is negative: " + lengths[i]);
                }
            }
            return new MultiProgressCoordinator(this);
        }
    }
}
