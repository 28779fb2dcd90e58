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

import io.nosqlbench.progress.ProgressDisplayMode;
import io.nosqlbench.progress.ProgressRenderer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Factory methods for the bundled {@link ProgressRenderer}s, and the lookup coordinators use when
 * no renderer is given.
 *
 * <p>The default comes from the {@code nb.progress.display} system property
 * ({@link ProgressDisplayMode#PROPERTY}):
 * <pre>
 * -Dnb.progress.display=auto   # ansi with a console, log without (default)
 * -Dnb.progress.display=ansi   # redrawn terminal lines
 * -Dnb.progress.display=log    # Log4j milestones
 * -Dnb.progress.display=off    # nothing
 * </pre>
 */
public final class ProgressRenderers {

    private static final Logger logger = LogManager.getLogger(ProgressRenderers.class);

    private ProgressRenderers() {
    }

    public static ProgressRenderer ansi() {
        return new AnsiProgressRenderer(System.out);
    }

    public static ProgressRenderer ansi(PrintStream output) {
        return new AnsiProgressRenderer(output);
    }

    public static ProgressRenderer logging() {
        return new LoggingProgressRenderer();
    }

    public static ProgressRenderer silent() {
        return SilentProgressRenderer.getInstance();
    }

    /**
     * @param mode the display mode; AUTO is resolved against the current process
     * @return the renderer for that mode
     */
    public static ProgressRenderer forMode(ProgressDisplayMode mode) {
        Objects.requireNonNull(mode, "mode");
        switch (mode.resolve()) {
            case ANSI:
                return ansi();
            case LOG:
                return logging();
            case OFF:
                return silent();
            case AUTO:
            default:
                throw new IllegalStateException("Display mode " + mode + " did not resolve to a concrete mode");
        }
    }

    /**
     * Reads {@code nb.progress.display}. An unrecognized value is reported and treated as auto.
     *
     * @return the renderer for the configured mode
     */
    public static ProgressRenderer fromSystemProperty() {
        return forMode(modeFromSystemProperty());
    }

    static ProgressDisplayMode modeFromSystemProperty() {
        String value = System.getProperty(ProgressDisplayMode.PROPERTY, ProgressDisplayMode.AUTO.getPropertyValue());
        try {
            return ProgressDisplayMode.fromString(value);
        } catch (IllegalArgumentException e) {
            logger.warn("{}; using {}", e.getMessage(), ProgressDisplayMode.AUTO);
            return ProgressDisplayMode.AUTO;
        }
    }
}
