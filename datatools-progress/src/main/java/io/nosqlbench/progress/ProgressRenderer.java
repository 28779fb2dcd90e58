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
 * Builds {@link ProgressTracker}s for a coordinator and owns whatever output they share.
 *
 * @see io.nosqlbench.progress.render.ProgressRenderers
 */
public interface ProgressRenderer {

    /**
     * Creates a tracker for one bar.
     *
     * @param total the bar's total, at least 0
     * @param lineOffset the terminal line the bar is drawn on, relative to the anchor line
     * @param config the merged configuration for this bar
     * @return a new tracker with count 0
     */
    ProgressTracker newTracker(long total, int lineOffset, ProgressConfig config);

    /**
     * Called once by a coordinator when its display is complete, so the cursor can be moved
     * below every line the coordinator used.
     *
     * @param highestOffset the largest line offset any bar of the coordinator was drawn on
     * @param config the coordinator's shared configuration
     */
    default void reserveLines(int highestOffset, ProgressConfig config) {
    }
}
