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
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;

/**
 * A bar drawn in place on a terminal, {@link #getLineOffset()} lines below the anchor line the
 * cursor rests on. Each redraw moves down to the bar's line, rewrites it, and moves back to the
 * anchor, so bars on different lines never overwrite each other.
 *
 * <p>Example line:
 * <pre>
 * task 3 [████████████░░░░░░░░░░░░░░░░░░]  40.0% 4/10
 * </pre>
 *
 * <p>Redraws are skipped when the visible text would not change.
 */
public class ConsoleProgressBar extends AbstractProgressTracker {

    private static final String ESC = "\u001b[";
    private static final String CLEAR_TO_END_OF_LINE = ESC + "K";
    private static final int BAR_WIDTH = 30;

    private final PrintStream output;
    private String lastLine;

    public ConsoleProgressBar(long total, int lineOffset, ProgressConfig config, PrintStream output) {
        super(total, lineOffset, config);
        this.output = Objects.requireNonNull(output, "output");
    }

    @Override
    protected void render() {
        String line = formatLine();
        if (line.equals(lastLine)) {
            return;
        }
        lastLine = line;

        int offset = getLineOffset();
        StringBuilder frame = new StringBuilder();
        for (int i = 0; i < offset; i++) {
            frame.append('\n');
        }
        frame.append('\r').append(line).append(CLEAR_TO_END_OF_LINE);
        if (offset > 0) {
            frame.append(ESC).append(offset).append('A');
        }
        frame.append('\r');

        // bars of different coordinators may share a stream
        synchronized (output) {
            output.print(frame);
            output.flush();
        }
    }

    String formatLine() {
        double fraction = getFraction();
        int filled = (int) (BAR_WIDTH * fraction);

        AttributedStyle barStyle = styleFor(getConfig().getColor().orElse(ProgressColor.DEFAULT));
        AttributedStringBuilder line = new AttributedStringBuilder();
        String description = getConfig().getDescription().orElse("");
        line.append(description);
        line.append("[");
        line.style(barStyle);
        for (int i = 0; i < filled; i++) {
            line.append("█");
        }
        for (int i = filled; i < BAR_WIDTH; i++) {
            line.append("░");
        }
        line.style(AttributedStyle.DEFAULT);
        line.append("]");
        line.append(String.format(Locale.ROOT, " %5.1f%% %d/%d", fraction * 100, getCount(), getTotal()));
        if (isCancelled()) {
            line.append(" CANCELLED");
        } else if (isComplete()) {
            line.append(" DONE");
        }
        return line.toAnsi();
    }

    private static AttributedStyle styleFor(ProgressColor color) {
        switch (color) {
            case BLACK:
                return AttributedStyle.DEFAULT.foreground(AttributedStyle.BLACK);
            case RED:
                return AttributedStyle.DEFAULT.foreground(AttributedStyle.RED);
            case GREEN:
                return AttributedStyle.DEFAULT.foreground(AttributedStyle.GREEN);
            case YELLOW:
                return AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW);
            case BLUE:
                return AttributedStyle.DEFAULT.foreground(AttributedStyle.BLUE);
            case MAGENTA:
                return AttributedStyle.DEFAULT.foreground(AttributedStyle.MAGENTA);
            case CYAN:
                return AttributedStyle.DEFAULT.foreground(AttributedStyle.CYAN);
            case WHITE:
                return AttributedStyle.DEFAULT.foreground(AttributedStyle.WHITE);
            case DEFAULT:
            default:
                return AttributedStyle.DEFAULT;
        }
    }
}
