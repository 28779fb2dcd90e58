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

import java.util.Arrays;
import java.util.Locale;

/**
 * Values of the {@code nb.progress.display} system property, which picks the renderer a
 * coordinator uses when none is given to it.
 *
 * @see io.nosqlbench.progress.render.ProgressRenderers#fromSystemProperty()
 */
public enum ProgressDisplayMode {
    /** ANSI when {@link System#console()} is present, LOG otherwise. */
    AUTO("auto", "default", ""),
    ANSI("ansi", "console", "bars", "tty"),
    LOG("log", "logger", "text"),
    /** Bars still count but draw nothing. */
    OFF("off", "none", "disable", "disabled", "false");

    public static final String PROPERTY = "nb.progress.display";

    private final String propertyValue;
    private final String[] names;

    ProgressDisplayMode(String... names) {
        this.propertyValue = names[0];
        this.names = names;
    }

    public String getPropertyValue() {
        return propertyValue;
    }

    /**
     * @param value a mode name or alias, matched case-insensitively after trimming
     * @return the mode, or {@code null} for a {@code null} value
     * @throws IllegalArgumentException if no mode answers to the value
     */
    public static ProgressDisplayMode fromString(String value) {
        if (value == null) {
            return null;
        }
        String wanted = value.trim().toLowerCase(Locale.ROOT);
        for (ProgressDisplayMode mode : values()) {
            if (Arrays.asList(mode.names).contains(wanted)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("No progress display mode named '" + value + "', use one of "
            + Arrays.toString(values()));
    }

    public ProgressDisplayMode resolve() {
        if (this != AUTO) {
            return this;
        }
        return System.console() != null ? ANSI : LOG;
    }

    @Override
    public String toString() {
        return propertyValue;
    }
}
