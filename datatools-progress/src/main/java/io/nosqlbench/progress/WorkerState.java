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

/**
 * What a {@link CoordinatorState} knows about one worker. Confined to the consumer loop.
 */
final class WorkerState {

    static final int NO_OFFSET = -1;

    private final int workerId;
    private final long length;
    private ProgressConfig config;

    private ProgressTracker tracker;
    private int assignedOffset = NO_OFFSET;
    private boolean finished;
    private boolean cancelled;

    WorkerState(int workerId, long length, ProgressConfig config) {
        this.workerId = workerId;
        this.length = length;
        this.config = config;
    }

    int getWorkerId() {
        return workerId;
    }

    long getLength() {
        return length;
    }

    ProgressConfig getConfig() {
        return config;
    }

    /**
     * Changes the configuration the worker's tracker will be created with.
     */
    void restyle(String description, ProgressColor color) {
        config = config.restyled(description, color);
    }

    boolean isMaterialized() {
        return tracker != null;
    }

    ProgressTracker getTracker() {
        return tracker;
    }

    void materialize(ProgressTracker tracker, int offset) {
        if (this.tracker != null) {
            throw new IllegalStateException("Worker " + workerId + " already has a tracker");
        }
        this.tracker = tracker;
        this.assignedOffset = offset;
    }

    int getAssignedOffset() {
        return assignedOffset;
    }

    boolean hasOffset() {
        return assignedOffset != NO_OFFSET;
    }

    /**
     * Marks the worker finished and gives up its offset.
     *
     * @return the offset the worker held, or {@link #NO_OFFSET}
     */
    int markFinished() {
        finished = true;
        int released = assignedOffset;
        assignedOffset = NO_OFFSET;
        return released;
    }

    void markCancelled() {
        cancelled = true;
    }

    boolean isFinished() {
        return finished;
    }

    boolean isCancelled() {
        return cancelled;
    }

    long getCount() {
        return tracker == null ? 0L : tracker.getCount();
    }

    @Override
    public String toString() {
        return "worker " + workerId + " " + getCount() + "/" + length
            + (finished ? (cancelled ? " cancelled" : " finished") : "")
            + (hasOffset() ? " @" + assignedOffset : "");
    }
}
