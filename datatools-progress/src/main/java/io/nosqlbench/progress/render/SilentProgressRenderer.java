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

import io.nosqlbench.progress.ProgressConfig;
import io.nosqlbench.progress.ProgressRenderer;
import io.nosqlbench.progress.ProgressTracker;

/**
 * Renderer for the {@code off} display mode: every bar is a {@link SilentProgressTracker}.
 */
public final class SilentProgressRenderer implements ProgressRenderer {

    private static final SilentProgressRenderer INSTANCE = new SilentProgressRenderer();

    private SilentProgressRenderer() {
    }

    public static SilentProgressRenderer getInstance() {
        return INSTANCE;
    }

    @Override
    public ProgressTracker newTracker(long total, int lineOffset, ProgressConfig config) {
        return new SilentProgressTracker(total, lineOffset, config);
    }
}
