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
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Reports every bar as a {@link LoggingProgressTracker} on one logger, at INFO unless another
 * level is given.
 *
 * <pre>{@code
 * ProgressRenderer renderer = new LoggingProgressRenderer("ingest.progress", Level.DEBUG);
 * }</pre>
 */
public class LoggingProgressRenderer implements ProgressRenderer {

    private final Logger logger;
    private final Level level;

    public LoggingProgressRenderer() {
        this(LogManager.getLogger(LoggingProgressRenderer.class));
    }

    public LoggingProgressRenderer(Logger logger) {
        this(logger, Level.INFO);
    }

    public LoggingProgressRenderer(Logger logger, Level level) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.level = Objects.requireNonNullElse(level, Level.INFO);
    }

    public LoggingProgressRenderer(String loggerName, Level level) {
        this(LogManager.getLogger(loggerName), level);
    }

    @Override
    public ProgressTracker newTracker(long total, int lineOffset, ProgressConfig config) {
        if (!config.isEnabled()) {
            return new SilentProgressTracker(total, lineOffset, config);
        }
        return new LoggingProgressTracker(total, lineOffset, config, logger, level);
    }

    public Level getLevel() {
        return level;
    }
}
