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

import io.nosqlbench.progress.eventing.ChannelClosedException;
import io.nosqlbench.progress.eventing.UpdateChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The single writer behind a coordinator: a daemon thread that takes messages off an
 * {@link UpdateChannel} one at a time and hands them to a handler, until the handler reports
 * that the display is complete.
 *
 * <p>The handler runs only on this thread, which is what lets coordinator state go without
 * locks. When the loop ends, for whatever reason, the channel is closed so that later sends are
 * dropped instead of piling up, and anything enqueued before the close is drained and logged.
 *
 * <p>A handler failure, {@link Error}s included, ends the loop. It is logged and rethrown to
 * every caller of {@link #await()}, wrapped in a {@link ProgressException} unless it already is
 * one.
 *
 * @param <M> the channel's message type
 */
final class ConsumerLoop<M> {

    private static final Logger logger = LogManager.getLogger(ConsumerLoop.class);

    /**
     * Applies one message on the consumer thread.
     *
     * @param <M> the message type
     */
    @FunctionalInterface
    interface Handler<M> {
        /**
         * @param message the received message
         * @return {@code true} to stop the loop
         */
        boolean handle(M message);
    }

    private final String name;
    private final UpdateChannel<M> channel;
    private final Handler<M> handler;
    private final CompletableFuture<Void> completion = new CompletableFuture<>();
    private final Thread thread;

    ConsumerLoop(String name, UpdateChannel<M> channel, Handler<M> handler) {
        this.name = name;
        this.channel = channel;
        this.handler = handler;
        this.thread = new Thread(this::run, name);
        this.thread.setDaemon(true);
    }

    void start() {
        thread.start();
    }

    /**
     * Marks the loop complete without starting its thread, for displays that have nothing to
     * wait for.
     */
    void completeWithoutStarting() {
        channel.close();
        completion.complete(null);
    }

    private void run() {
        logger.debug("{} started", name);
        Throwable failure = null;
        try {
            while (true) {
                M message;
                try {
                    message = channel.receive();
                } catch (ChannelClosedException e) {
                    logger.debug("{} channel closed before the display completed", name);
                    break;
                }
                if (handler.handle(message)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = new ProgressException(name + " was interrupted", e);
        } catch (RuntimeException e) {
            logger.error("{} stopped: {}", name, e.getMessage(), e);
            failure = e;
        } catch (Error e) {
            logger.error("{} stopped: {}", name, e.toString(), e);
            failure = e;
            throw e;
        } finally {
            discardRemaining();
            if (failure == null) {
                completion.complete(null);
                logger.debug("{} completed", name);
            } else {
                completion.completeExceptionally(failure);
            }
        }
    }

    /**
     * Closes the channel and drains whatever producers managed to enqueue before it closed.
     */
    private void discardRemaining() {
        channel.close();
        if (Thread.currentThread().isInterrupted()) {
            return;
        }
        try {
            while (true) {
                M message = channel.receive();
                logger.debug("{} dropped {} sent after the display completed", name, message);
            }
        } catch (ChannelClosedException e) {
            logger.trace("{} channel drained", name);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    boolean isDone() {
        return completion.isDone();
    }

    /**
     * Blocks until the loop has ended.
     *
     * @throws ProgressException if the loop failed, or the caller was interrupted while waiting
     */
    void await() {
        try {
            completion.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProgressException("Interrupted while waiting for " + name, e);
        } catch (ExecutionException e) {
            throw failure(e);
        }
    }

    /**
     * Blocks until the loop has ended or the timeout elapses.
     *
     * @param timeout how long to wait
     * @return {@code true} if the loop ended in time
     * @throws ProgressException if the loop failed, or the caller was interrupted while waiting
     */
    boolean await(Duration timeout) {
        try {
            completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProgressException("Interrupted while waiting for " + name, e);
        } catch (ExecutionException e) {
            throw failure(e);
        }
    }

    private ProgressException failure(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof ProgressException) {
            return (ProgressException) cause;
        }
        return new ProgressException(name + " failed: " + cause.getMessage(), cause);
    }

    String getName() {
        return name;
    }
}
