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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Draws every bar as a {@link ConsoleProgressBar} on its own terminal line. Bars go to the
 * stream named in their configuration, or to this renderer's default stream.
 *
 * <p>{@link #reserveLines(int, ProgressConfig)} moves the cursor below the bars on every stream
 * a bar was created for since the last reservation, whatever the shared configuration says.
 */
public class AnsiProgressRenderer implements ProgressRenderer {

    private final PrintStream defaultOutput;
    private final Set<PrintStream> drawnOutputs = Collections.synchronizedSet(
        Collections.newSetFromMap(new IdentityHashMap<>()));

    public AnsiProgressRenderer() {
        this(System.out);
    }

    public AnsiProgressRenderer(PrintStream defaultOutput) {
        this.defaultOutput = Objects.requireNonNull(defaultOutput, "defaultOutput");
    }

    @Override
    public ProgressTracker newTracker(long total, int lineOffset, ProgressConfig config) {
        if (!config.isEnabled()) {
            return new SilentProgressTracker(total, lineOffset, config);
        }
        PrintStream output = config.getOutput().orElse(defaultOutput);
        drawnOutputs.add(output);
        return new ConsoleProgressBar(total, lineOffset, config, output);
    }

    @Override
    public void reserveLines(int highestOffset, ProgressConfig config) {
        List<PrintStream> outputs;
        synchronized (drawnOutputs) {
            outputs = new ArrayList<>(drawnOutputs);
            drawnOutputs.clear();
        }
        StringBuilder lines = new StringBuilder();
        for (int i = 0; i <= highestOffset; i++) {
            lines.append('\n');
        }
        for (PrintStream output : outputs) {
            synchronized (output) {
                output.print(lines);
                output.flush();
            }
        }
    }
}
