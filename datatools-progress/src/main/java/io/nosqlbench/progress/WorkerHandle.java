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
import io.nosqlbench.progress.eventing.WorkerMessage;

/**
 * One worker's view of a {@link MultiProgressCoordinator}. Every call is tagged with the worker id
 * and written to the coordinator's shared channel; the handle holds no other state.
 *
 * <p>Hand one handle to each concurrent worker. Sharing a handle between threads is also safe,
 * since sending is.
 *
 * <pre>{@code
 * WorkerHandle handle = coordinator.worker(3);
 * for (Item item : items) {
 *     process(item);
 *     handle.next();
 * }
 * }</pre>
 */
public final class WorkerHandle extends ChannelReporter<WorkerMessage> {

    private final int workerId;
    private final long length;

    WorkerHandle(UpdateChannel<WorkerMessage> channel, int workerId, long length) {
        super(channel);
        this.workerId = workerId;
        this.length = length;
    }

    @Override
    protected WorkerMessage wrap(UpdateMessage update) {
        return new WorkerMessage(workerId, update);
    }

    /**
     * @return the 1-based id of the worker bar this handle drives
     */
    public int getWorkerId() {
        return workerId;
    }

    /**
     * @return the total this worker's bar counts to
     */
    public long getLength() {
        return length;
    }

    @Override
    public String toString() {
        return "WorkerHandle{" + workerId + "/" + length + "}";
    }
}
