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

import java.io.Serializable;
import java.util.Objects;

/**
 * An {@link UpdateMessage} tagged with the id of the worker bar it targets. This is the
 * element type of the channel shared by all workers of a multi-bar coordinator.
 */
public final class WorkerMessage implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int workerId;
    private final UpdateMessage update;

    public WorkerMessage(int workerId, UpdateMessage update) {
        this.workerId = workerId;
        this.update = Objects.requireNonNull(update, "update");
    }

    public int getWorkerId() {
        return workerId;
    }

    public UpdateMessage getUpdate() {
        return update;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WorkerMessage)) {
            return false;
        }
        WorkerMessage that = (WorkerMessage) o;
        return workerId == that.workerId && update.equals(that.update);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workerId, update);
    }

    @Override
    public String toString() {
        return "worker " + workerId + ": " + update;
    }
}
