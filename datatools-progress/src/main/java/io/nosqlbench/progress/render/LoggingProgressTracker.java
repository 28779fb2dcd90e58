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
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Objects;

/**
 * A bar reported through Log4j instead of drawn. It logs when the bar starts moving, each time
 * it crosses another tenth of its total, and when it completes or is cancelled. Suited to
 * headless runs where redrawing terminal lines would only fill the log with escape codes.
 */
public class LoggingProgressTracker extends AbstractProgressTracker {

    private static final int STEPS = 10;

    private final Logger logger;
    private final Level level;

    private boolean started;
    private int lastStep;

    public LoggingProgressTracker(long total, int lineOffset, ProgressConfig config, Logger logger, Level level) {
        super(total, lineOffset, config);
        this.logger = Objects.requireNonNull(logger, "logger");
        this.level = Objects.requireNonNullElse(level, Level.INFO);
    }

    private String label() {
        String description = getConfig().getDescription().map(String::trim).orElse("");
        if (!description.isEmpty()) {
            return description;
        }
        return getLineOffset() == 0 ? "progress" : "bar " + getLineOffset();
    }

    @Override
    protected void render() {
        if (!logger.isEnabled(level)) {
            return;
        }
        String label = label();
        if (!started) {
            started = true;
            logger.log(level, "{} started: {}/{}", label, getCount(), getTotal());
        }
        if (isCancelled()) {
            logger.log(level, "{} cancelled at {}/{}", label, getCount(), getTotal());
            return;
        }
        if (isComplete()) {
            logger.log(level, "{} complete: {}/{}", label, getCount(), getTotal());
            lastStep = STEPS;
            return;
        }
        int step = (int) (getFraction() * STEPS);
        if (step != lastStep) {
            lastStep = step;
            logger.log(level, String.format(Locale.ROOT, "%s [%.1f%%] %d/%d", label, getFraction() * 100, getCount(), getTotal()));
        }
    }
}
