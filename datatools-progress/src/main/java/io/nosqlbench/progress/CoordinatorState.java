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

import io.nosqlbench.progress.eventing.UpdateKind;
import io.nosqlbench.progress.eventing.UpdateMessage;
import io.nosqlbench.progress.eventing.WorkerMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.SortedSet;

/**
 * Everything a {@link MultiProgressCoordinator} displays: one lazily created tracker per worker,
 * the aggregate tracker, and the pool of terminal lines the worker bars are drawn on.
 *
 * <p>This class takes no locks. It is mutated only by {@link #apply(WorkerMessage)}, which the
 * coordinator calls from its single consumer thread. After every applied message the aggregate
 * count equals the sum of the materialized worker counts.
 *
 * <p>The aggregate bar is drawn at offset 0. Worker bars get the smallest free offset from 1 up
 * when their first message arrives, and give it back the moment they reach their length or are
 * cancelled.
 */
final class CoordinatorState {

    private static final Logger logger = LogManager.getLogger(CoordinatorState.class);

    static final int AGGREGATE_OFFSET = 0;
    static final int FIRST_WORKER_OFFSET = 1;

    private final WorkerState[] workers;
    private final ProgressConfig sharedConfig;
    private final ProgressRenderer renderer;
    private final ProgressTracker aggregate;
    private final OffsetPool offsets = new OffsetPool(FIRST_WORKER_OFFSET);

    private int unfinished;
    private boolean terminated;

    /**
     * @param lengths the total of each worker, in worker id order; zero-length workers start finished
     * @param sharedConfig configuration for the aggregate and every worker
     * @param perWorkerConfigs per-worker overrides, one per length
     * @param renderer builds the trackers
     */
    CoordinatorState(long[] lengths,
                     ProgressConfig sharedConfig,
                     List<ProgressConfig> perWorkerConfigs,
                     ProgressRenderer renderer) {
        if (lengths.length != perWorkerConfigs.size()) {
            throw new IllegalArgumentException("Got " + lengths.length + " lengths but "
                + perWorkerConfigs.size() + " per-worker configurations");
        }
        this.sharedConfig = sharedConfig;
        this.renderer = renderer;
        this.workers = new WorkerState[lengths.length];

        long total = 0;
        for (int i = 0; i < lengths.length; i++) {
            long length = lengths[i];
            if (length < 0) {
                throw new IllegalArgumentException("Length of worker " + (i + 1) + " is negative: " + length);
            }
            total = Math.addExact(total, length);
            WorkerState worker = new WorkerState(i + 1, length, sharedConfig.overriddenBy(perWorkerConfigs.get(i)));
            if (length == 0) {
                worker.markFinished();
            } else {
                unfinished++;
            }
            workers[i] = worker;
        }

        this.aggregate = renderer.newTracker(total, AGGREGATE_OFFSET, sharedConfig);
        // nothing to wait for: no bar is ever drawn
        this.terminated = unfinished == 0;
    }

    /**
     * Applies one message.
     *
     * @param message the message to apply
     * @return {@code true} if the display is complete and no further messages will be applied
     * @throws ProtocolViolationException if the message targets an undeclared worker id
     */
    boolean apply(WorkerMessage message) {
        if (terminated) {
            logger.debug("Ignoring {} after the display completed", message);
            return true;
        }

        WorkerState worker = workerOrFail(message.getWorkerId());
        UpdateMessage update = message.getUpdate();

        if (worker.isFinished()) {
            logger.trace("Ignoring {} for finished {}", update, worker);
            return false;
        }

        if (!worker.isMaterialized()) {
            if (update.getKind() == UpdateKind.RESTYLE) {
                // kept for when the worker gets its line
                worker.restyle(update.getDescription(), update.getColor());
                return false;
            }
            if (update.getKind() == UpdateKind.CANCEL) {
                // cancelled before its first update, so it never gets a line
                worker.markCancelled();
                worker.markFinished();
                unfinished--;
                return checkTerminal();
            }
            materialize(worker);
        }

        ProgressTracker tracker = worker.getTracker();
        long previousCount = tracker.getCount();

        switch (update.getKind()) {
            case NEXT:
                tracker.advance();
                break;
            case SET_VALUE:
                tracker.setValue(Math.min(update.getValue(), worker.getLength()));
                break;
            case FINISH:
                tracker.finish();
                break;
            case CANCEL:
                tracker.cancel();
                worker.markCancelled();
                break;
            case RESTYLE:
                tracker.restyle(update.getDescription(), update.getColor());
                break;
            default:
                throw new ProtocolViolationException("Unknown update kind " + update.getKind());
        }

        long delta = tracker.getCount() - previousCount;
        aggregate.setValue(aggregate.getCount() + delta);

        if (worker.isCancelled() || tracker.getCount() >= worker.getLength()) {
            int released = worker.markFinished();
            offsets.release(released);
            unfinished--;
            logger.debug("Worker {} {} at {}/{}, released line {}", worker.getWorkerId(),
                worker.isCancelled() ? "cancelled" : "finished", tracker.getCount(), worker.getLength(), released);
        }

        return checkTerminal();
    }

    private WorkerState workerOrFail(int workerId) {
        if (workerId < 1 || workerId > workers.length) {
            throw new ProtocolViolationException("Worker id " + workerId + " is outside [1, " + workers.length + "]");
        }
        return workers[workerId - 1];
    }

    private void materialize(WorkerState worker) {
        int offset = offsets.acquire();
        ProgressTracker tracker = renderer.newTracker(worker.getLength(), offset, worker.getConfig());
        worker.materialize(tracker, offset);
        logger.debug("Worker {} started on line {}", worker.getWorkerId(), offset);
    }

    private boolean checkTerminal() {
        if (unfinished > 0 && aggregate.getCount() < aggregate.getTotal()) {
            return false;
        }
        if (aggregate.getCount() >= aggregate.getTotal()) {
            aggregate.finish();
        } else {
            aggregate.cancel();
        }
        renderer.reserveLines(offsets.getHighWater(), sharedConfig);
        terminated = true;
        logger.debug("Display complete at {}/{} using {} worker lines",
            aggregate.getCount(), aggregate.getTotal(), offsets.getHighWater());
        return true;
    }

    boolean isTerminated() {
        return terminated;
    }

    ProgressTracker getAggregate() {
        return aggregate;
    }

    int getWorkerCount() {
        return workers.length;
    }

    WorkerState getWorker(int workerId) {
        return workerOrFail(workerId);
    }

    /**
     * @return the number of workers that have neither reached their length nor been cancelled
     */
    int getUnfinishedCount() {
        return unfinished;
    }

    SortedSet<Integer> getOffsetsInUse() {
        return offsets.snapshot();
    }

    /**
     * @return the largest worker line offset ever assigned, 0 if no worker bar was drawn
     */
    int getHighWaterOffset() {
        return offsets.getHighWater();
    }
}
