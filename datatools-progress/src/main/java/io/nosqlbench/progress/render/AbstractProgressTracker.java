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

package io.nosqlbench.progress.render;

import io.nosqlbench.progress.ProgressColor;
import io.nosqlbench.progress.ProgressConfig;
import io.nosqlbench.progress.ProgressTracker;

import java.util.Objects;

/**
 * Count bookkeeping shared by the bundled trackers. Subclasses only decide how a bar is shown,
 * in {@link #render()}, which runs after every change of state.
 *
 * <p>Once a bar is finished or cancelled it ignores further updates. Fields are volatile so that
 * the count can be read from threads other than the one driving the bar.
 */
public abstract class AbstractProgressTracker implements ProgressTracker {

    private final long total;
    private final int lineOffset;
    private volatile ProgressConfig config;

    private volatile long count;
    private volatile boolean finished;
    private volatile boolean cancelled;

    protected AbstractProgressTracker(long total, int lineOffset, ProgressConfig config) {
        if (total < 0) {
            throw new IllegalArgumentException("Total must be non-negative, got " + total);
        }
        if (lineOffset < 0) {
            throw new IllegalArgumentException("Line offset must be non-negative, got " + lineOffset);
        }
        this.total = total;
        this.lineOffset = lineOffset;
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Shows the current state of the bar.
     */
    protected abstract void render();

    @Override
    public void advance() {
        if (isStopped()) {
            return;
        }
        count = count + 1;
        render();
    }

    @Override
    public void setValue(long value) {
        if (isStopped()) {
            return;
        }
        count = value;
        render();
    }

    @Override
    public void finish() {
        if (isStopped()) {
            return;
        }
        count = total;
        finished = true;
        render();
    }

    @Override
    public void cancel() {
        if (isStopped()) {
            return;
        }
        cancelled = true;
        render();
    }

    @Override
    public void restyle(String description, ProgressColor color) {
        if (isStopped()) {
            return;
        }
        config = config.restyled(description, color);
        render();
    }

    @Override
    public long getCount() {
        return count;
    }

    @Override
    public long getTotal() {
        return total;
    }

    @Override
    public int getLineOffset() {
        return lineOffset;
    }

    public ProgressConfig getConfig() {
        return config;
    }

    /**
     * @return {@code true} if the count has reached the total or {@link #finish()} was called
     */
    public boolean isComplete() {
        return finished || count >= total;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    protected boolean isStopped() {
        return finished || cancelled;
    }

    /**
     * @return completed fraction in {@code [0, 1]}; a bar with total 0 counts as complete
     */
    public double getFraction() {
        if (total == 0) {
            return 1.0d;
        }
        return Math.min(1.0d, Math.max(0.0d, (double) count / total));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + config.getDescription().orElse("") + count + "/" + total
            + " @" + lineOffset + (cancelled ? " cancelled" : isComplete() ? " done" : "") + "}";
    }
}
