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

import io.nosqlbench.progress.ProgressColor;

import java.io.Serializable;
import java.util.Objects;

/**
 * An immutable progress instruction sent from a producer to a coordinator's consumer loop.
 *
 * <p>Only {@link UpdateKind#SET_VALUE} carries a value; for every other kind the value is
 * always {@code 0}. Only {@link UpdateKind#RESTYLE} carries a description or a color.
 * Instances without a payload are shared constants, so producers can send {@link #next()} in a
 * tight loop without allocating.
 *
 * <p>Messages are {@link Serializable} so that an {@link UpdateChannel} implementation may
 * carry them across a process boundary.
 *
 * @see UpdateKind
 * @see WorkerMessage
 */
public final class UpdateMessage implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final UpdateMessage NEXT = new UpdateMessage(UpdateKind.NEXT, 0L, null, null);
    private static final UpdateMessage FINISH = new UpdateMessage(UpdateKind.FINISH, 0L, null, null);
    private static final UpdateMessage CANCEL = new UpdateMessage(UpdateKind.CANCEL, 0L, null, null);

    private final UpdateKind kind;
    private final long value;
    private final String description;
    private final ProgressColor color;

    private UpdateMessage(UpdateKind kind, long value, String description, ProgressColor color) {
        this.kind = kind;
        this.value = value;
        this.description = description;
        this.color = color;
    }

    public static UpdateMessage next() {
        return NEXT;
    }

    /**
     * @param value the absolute count to move the bar to
     * @return a SET_VALUE message
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static UpdateMessage setValue(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("progress value must be non-negative, got " + value);
        }
        return new UpdateMessage(UpdateKind.SET_VALUE, value, null, null);
    }

    /**
     * @param description the new description, or {@code null} to keep the current one
     * @param color the new bar color, or {@code null} to keep the current one
     * @return a RESTYLE message
     * @throws IllegalArgumentException if both are {@code null}
     */
    public static UpdateMessage restyle(String description, ProgressColor color) {
        if (description == null && color == null) {
            throw new IllegalArgumentException("restyle needs a description or a color");
        }
        return new UpdateMessage(UpdateKind.RESTYLE, 0L, description, color);
    }

    public static UpdateMessage finish() {
        return FINISH;
    }

    public static UpdateMessage cancel() {
        return CANCEL;
    }

    public UpdateKind getKind() {
        return kind;
    }

    /**
     * @return the requested count for SET_VALUE messages, {@code 0} otherwise
     */
    public long getValue() {
        return value;
    }

    /**
     * @return the requested description of a RESTYLE message, {@code null} if unchanged
     */
    public String getDescription() {
        return description;
    }

    /**
     * @return the requested color of a RESTYLE message, {@code null} if unchanged
     */
    public ProgressColor getColor() {
        return color;
    }

    private Object readResolve() {
        switch (kind) {
            case NEXT:
                return NEXT;
            case FINISH:
                return FINISH;
            case CANCEL:
                return CANCEL;
            default:
                return this;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UpdateMessage)) {
            return false;
        }
        UpdateMessage that = (UpdateMessage) o;
        return value == that.value && kind == that.kind
            && Objects.equals(description, that.description) && color == that.color;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, description, color);
    }

    @Override
    public String toString() {
        switch (kind) {
            case SET_VALUE:
                return kind + "(" + value + ")";
            case RESTYLE:
                return kind + "(" + (description == null ? "" : "'" + description + "'")
                    + (color == null ? "" : " " + color) + ")";
            default:
                return kind.name();
        }
    }
}
