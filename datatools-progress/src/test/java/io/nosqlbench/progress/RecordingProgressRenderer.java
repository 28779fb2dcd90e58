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

import io.nosqlbench.progress.render.AbstractProgressTracker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test renderer that keeps every tracker it builds, in creation order, and every line
 * reservation. For a multi coordinator the first tracker is the aggregate.
 */
public class RecordingProgressRenderer implements ProgressRenderer {

    public final List<RecordingTracker> trackers = new CopyOnWriteArrayList<>();
    public final List<Integer> reservations = new CopyOnWriteArrayList<>();

    @Override
    public ProgressTracker newTracker(long total, int lineOffset, ProgressConfig config) {
        RecordingTracker tracker = new RecordingTracker(total, lineOffset, config);
        trackers.add(tracker);
        return tracker;
    }

    @Override
    public void reserveLines(int highestOffset, ProgressConfig config) {
        reservations.add(highestOffset);
    }

    public RecordingTracker aggregate() {
        return trackers.get(0);
    }

    /**
     * @return the worker trackers, in the order their workers first reported
     */
    public List<RecordingTracker> workerTrackers() {
        return new ArrayList<>(trackers.subList(1, trackers.size()));
    }

    public RecordingTracker trackerWithDescription(String description) {
        for (RecordingTracker tracker : trackers) {
            if (tracker.getConfig().getDescription().orElse("").equals(description)) {
                return tracker;
            }
        }
        throw new AssertionError("No tracker described as '" + description + "' in " + trackers);
    }

    public static final class RecordingTracker extends AbstractProgressTracker {

        public final List<String> events = new CopyOnWriteArrayList<>();

        RecordingTracker(long total, int lineOffset, ProgressConfig config) {
            super(total, lineOffset, config);
        }

        @Override
        protected void render() {
            if (isCancelled()) {
                events.add("cancel");
            } else if (isComplete()) {
                events.add("complete");
            } else {
                events.add(String.valueOf(getCount()));
            }
        }
    }
}
