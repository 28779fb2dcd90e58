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
import io.nosqlbench.progress.eventing.UpdateMessage;
import io.nosqlbench.progress.render.ProgressRenderers;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lets one progress bar be driven from any number of threads. Calls enqueue an update and return
 * at once; a dedicated consumer thread applies the updates to the bar in order.
 *
 * <p>The consumer stops when the bar reaches its total, on {@link #finish()}, or on
 * {@link #cancel()}. Updates sent after that are dropped.
 *
 * <pre>{@code
 * try (SingleProgressCoordinator progress = new SingleProgressCoordinator(items.size(),
 *         ProgressConfig.builder().description("indexing ").build())) {
 *     items.parallelStream().forEach(item -> {
 *         index(item);
 *         progress.next();
 *     });
 *     progress.awaitCompletion();
 * }
 * }</pre>
 */
public class SingleProgressCoordinator extends ChannelReporter<UpdateMessage> implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(SingleProgressCoordinator.class);

    private static final int MIN_CHANNEL_CAPACITY = 64;
    private static final int MAX_DEFAULT_CHANNEL_CAPACITY = 1 << 16;
    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private final ProgressTracker tracker;
    private final ProgressRenderer renderer;
    private final ProgressConfig config;
    private final ConsumerLoop<UpdateMessage> loop;

    public SingleProgressCoordinator(long total) {
        this(total, ProgressConfig.empty());
    }

    public SingleProgressCoordinator(long total, ProgressConfig config) {
        this(total, config, ProgressRenderers.fromSystemProperty());
    }

    public SingleProgressCoordinator(long total, ProgressConfig config, ProgressRenderer renderer) {
        this(total, 0, config, renderer, new BlockingUpdateChannel<>(defaultCapacity(total)));
    }

    /**
     * @param total the bar's total, at least 0; a bar with total 0 is complete immediately
     * @param lineOffset the terminal line to draw the bar on
     * @param config the bar's configuration
     * @param renderer builds the bar
     * @param channel carries updates to the consumer thread; owned by this coordinator from now on
     */
    public SingleProgressCoordinator(long total,
                                     int lineOffset,
                                     ProgressConfig config,
                                     ProgressRenderer renderer,
                                     UpdateChannel<UpdateMessage> channel) {
        super(channel);
        if (total < 0) {
            throw new IllegalArgumentException("Total must be non-negative, got " + total);
        }
        if (lineOffset < 0) {
            throw new IllegalArgumentException("Line offset must be non-negative, got " + lineOffset);
        }
        this.config = Objects.requireNonNull(config, "config");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.tracker = renderer.newTracker(total, lineOffset, config);
        this.loop = new ConsumerLoop<>("SingleProgress-" + SEQUENCE.incrementAndGet(), channel, this::apply);

        if (total == 0) {
            loop.completeWithoutStarting();
        } else {
            loop.start();
        }
    }

    private static int defaultCapacity(long total) {
        return (int) Math.min(MAX_DEFAULT_CHANNEL_CAPACITY, Math.max(MIN_CHANNEL_CAPACITY, total));
    }

    @Override
    protected UpdateMessage wrap(UpdateMessage update) {
        return update;
    }

    private boolean apply(UpdateMessage update) {
        boolean stop;
        switch (update.getKind()) {
            case NEXT:
                tracker.advance();
                stop = tracker.getCount() >= tracker.getTotal();
                break;
            case SET_VALUE:
                tracker.setValue(Math.min(update.getValue(), tracker.getTotal()));
                stop = tracker.getCount() >= tracker.getTotal();
                break;
            case FINISH:
                tracker.finish();
                stop = true;
                break;
            case CANCEL:
                tracker.cancel();
                stop = true;
                break;
            case RESTYLE:
                tracker.restyle(update.getDescription(), update.getColor());
                stop = false;
                break;
            default:
                throw new ProtocolViolationException("Unknown update kind " + update.getKind());
        }
        if (stop) {
            renderer.reserveLines(tracker.getLineOffset(), config);
            logger.debug("{} stopped at {}/{} after {}", loop.getName(), tracker.getCount(), tracker.getTotal(), update);
        }
        return stop;
    }

    /**
     * @return the bar being driven; read its count from other threads only as a snapshot
     */
    public ProgressTracker getTracker() {
        return tracker;
    }

    /**
     * @return {@code true} once the consumer thread has stopped
     */
    public boolean isComplete() {
        return loop.isDone();
    }

    /**
     * Waits for the consumer thread to apply its last update.
     *
     * @throws ProgressException if the consumer failed or the caller was interrupted
     */
    public void awaitCompletion() {
        loop.await();
    }

    /**
     * @param timeout how long to wait
     * @return {@code true} if the consumer stopped in time
     * @throws ProgressException if the consumer failed or the caller was interrupted
     */
    public boolean awaitCompletion(Duration timeout) {
        return loop.await(timeout);
    }

    /**
     * Cancels the bar if it is still running and waits for the consumer thread to stop.
     */
    @Override
    public void close() {
        if (!loop.isDone()) {
            cancel();
        }
        loop.await();
    }

    @Override
    public String toString() {
        return loop.getName() + "[" + tracker.getCount() + "/" + tracker.getTotal() + "]";
    }
}
