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
 * The state and rendering of one progress bar.
 *
 * <p>A tracker is driven by exactly one thread, the consumer loop of the coordinator that
 * created it. Implementations therefore need no locking for their own mutation, but should
 * publish {@link #getCount()} safely (for example through a volatile field) so that other
 * threads can observe it.
 *
 * <p>Trackers do not clamp. The coordinator guarantees {@code count <= total} before it calls
 * {@link #setValue(long)} or {@link #advance()}.
 *
 * @see ProgressRenderer
 */
public interface ProgressTracker {

    /**
     * Advances the count by one.
     */
    void advance();

    /**
     * Moves the count to an absolute value.
     *
     * @param value the new count, already within {@code [0, total]}
     */
    void setValue(long value);

    /**
     * Moves the count to the total and marks the bar complete.
     */
    void finish();

    /**
     * Marks the bar stopped at its current count.
     */
    void cancel();

    /**
     * Changes how the bar is labelled and drawn. Ignored once the bar is finished or cancelled.
     *
     * @param description the new description, or {@code null} to keep the current one
     * @param color the new color, or {@code null} to keep the current one
     */
    void restyle(String description, ProgressColor color);

    long getCount();

    long getTotal();

    /**
     * @return the terminal line this bar is drawn on, relative to the display anchor
     */
    int getLineOffset();
}
