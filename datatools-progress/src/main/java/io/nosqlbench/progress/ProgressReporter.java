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
 * The producer side of a progress bar. Every call enqueues an update and returns; the update is
 * applied later, in call order, by the owning coordinator's consumer loop.
 *
 * <p>Implementations are safe to call from any thread.
 *
 * @see SingleProgressCoordinator
 * @see WorkerHandle
 */
public interface ProgressReporter {

    /**
     * Advances the bar by one.
     */
    void next();

    /**
     * Moves the bar to an absolute count. Values above the bar's total are clamped to it.
     *
     * @param value the new count
     * @throws IllegalArgumentException if value is negative
     */
    void setValue(long value);

    /**
     * Completes the bar.
     */
    void finish();

    /**
     * Stops the bar at its current count and releases its display line.
     */
    void cancel();

    /**
     * Replaces the bar's description.
     *
     * @param description the new description
     */
    void describe(String description);

    /**
     * Replaces the bar's color.
     *
     * @param color the new color
     */
    void recolor(ProgressColor color);
}
