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

package io.nosqlbench.progress.eventing;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process {@link UpdateChannel} backed by a {@link LinkedBlockingQueue}.
 *
 * <p>Both ends wait in short timed slices so that a {@link #close()} is noticed by a blocked
 * producer or consumer without needing a sentinel message in the queue.
 *
 * <p>A send that races with {@link #close()} either reports {@code true} because the message
 * was taken off the queue, or withdraws the message and reports {@code false}.
 *
 * @param <M> the message type
 */
public class BlockingUpdateChannel<M> implements UpdateChannel<M> {

    private static final long WAIT_SLICE_MILLIS = 50;

    private final BlockingQueue<M> queue;
    private final int capacity;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates an unbounded channel.
     */
    public BlockingUpdateChannel() {
        this(Integer.MAX_VALUE);
    }

    /**
     * Creates a channel that holds at most {@code capacity} unconsumed messages.
     *
     * @param capacity the maximum number of queued messages
     * @throws IllegalArgumentException if capacity is less than 1
     */
    public BlockingUpdateChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Channel capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    @Override
    public boolean send(M message) throws InterruptedException {
        Objects.requireNonNull(message, "message");
        while (!closed.get()) {
            if (queue.offer(message, WAIT_SLICE_MILLIS, TimeUnit.MILLISECONDS)) {
                // closed while offering: nothing will take it unless the consumer already did
                return !closed.get() || !queue.remove(message);
            }
        }
        return false;
    }

    @Override
    public M receive() throws InterruptedException {
        while (true) {
            M message = queue.poll(WAIT_SLICE_MILLIS, TimeUnit.MILLISECONDS);
            if (message != null) {
                return message;
            }
            if (closed.get() && queue.isEmpty()) {
                throw new ChannelClosedException("Channel is closed and drained");
            }
        }
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    /**
     * @return the number of messages waiting to be received
     */
    public int size() {
        return queue.size();
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    public void close() {
        closed.set(true);
    }
}
