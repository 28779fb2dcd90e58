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

/**
 * An ordered, blocking, multi-producer/single-consumer queue of progress messages.
 *
 * <p>Contract:
 * <ul>
 *   <li>{@link #send} may be called concurrently from any number of producers without
 *       external locking. Messages from one producer are received in the order that producer
 *       sent them; messages from different producers interleave in arrival order.</li>
 *   <li>{@link #receive} is called by exactly one consumer and blocks until a message is
 *       available.</li>
 *   <li>A bounded implementation blocks {@link #send} while full. That is backpressure, not
 *       an error.</li>
 *   <li>After {@link #close}, sends are dropped and {@link #receive} drains what is left, then
 *       throws {@link ChannelClosedException}.</li>
 * </ul>
 *
 * <p>Implementations that cross a thread, process or machine boundary only need to honor this
 * contract; the coordinators never look past it.
 *
 * @param <M> the message type
 * @see BlockingUpdateChannel
 */
public interface UpdateChannel<M> extends AutoCloseable {

    /**
     * Enqueues a message, blocking while a bounded channel is full.
     *
     * @param message the message to send, never null
     * @return {@code true} if the message was accepted, {@code false} if the channel is closed
     * @throws InterruptedException if interrupted while waiting for capacity
     */
    boolean send(M message) throws InterruptedException;

    /**
     * Takes the next message, blocking until one is available.
     *
     * @return the next message
     * @throws InterruptedException if interrupted while waiting
     * @throws ChannelClosedException if the channel is closed and drained
     */
    M receive() throws InterruptedException;

    boolean isClosed();

    /**
     * Closes the channel. Idempotent.
     */
    @Override
    void close();
}
