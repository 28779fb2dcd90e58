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

import io.nosqlbench.progress.eventing.UpdateChannel;
import io.nosqlbench.progress.eventing.UpdateMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * A {@link ProgressReporter} that turns each call into a message on an {@link UpdateChannel}.
 * Subclasses decide how an {@link UpdateMessage} is wrapped for their channel.
 *
 * <p>A message sent after the coordinator has terminated is dropped: the channel is closed by
 * then, and there is nothing left to update.
 *
 * @param <M> the channel's message type
 */
public abstract class ChannelReporter<M> implements ProgressReporter {

    private static final Logger logger = LogManager.getLogger(ChannelReporter.class);

    private final UpdateChannel<M> channel;

    protected ChannelReporter(UpdateChannel<M> channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    /**
     * Wraps an update for this reporter's channel.
     *
     * @param update the update to send
     * @return the message to put on the channel
     */
    protected abstract M wrap(UpdateMessage update);

    @Override
    public void next() {
        send(UpdateMessage.next());
    }

    @Override
    public void setValue(long value) {
        send(UpdateMessage.setValue(value));
    }

    @Override
    public void finish() {
        send(UpdateMessage.finish());
    }

    @Override
    public void cancel() {
        send(UpdateMessage.cancel());
    }

    @Override
    public void describe(String description) {
        send(UpdateMessage.restyle(Objects.requireNonNull(description, "description"), null));
    }

    @Override
    public void recolor(ProgressColor color) {
        send(UpdateMessage.restyle(null, Objects.requireNonNull(color, "color")));
    }

    /**
     * Sends an update, blocking while the channel is full.
     *
     * @param update the update to send
     * @return {@code true} if the channel accepted the message
     * @throws ProgressException if interrupted while waiting for channel capacity
     */
    protected boolean send(UpdateMessage update) {
        M message = wrap(update);
        try {
            boolean accepted = channel.send(message);
            if (!accepted) {
                logger.debug("Dropped {} sent after the display completed", message);
            }
            return accepted;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProgressException("Interrupted while sending " + message, e);
        }
    }

    protected UpdateChannel<M> getChannel() {
        return channel;
    }
}
