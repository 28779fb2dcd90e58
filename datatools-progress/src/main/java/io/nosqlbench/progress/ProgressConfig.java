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

import java.io.PrintStream;
import java.util.Objects;
import java.util.Optional;

/**
 * Options passed through to {@link ProgressTracker} construction: a description, a color,
 * whether the bar is drawn at all, and the stream it is drawn on.
 *
 * <p>Every option is optional. A coordinator applies its shared configuration to every bar and
 * to the aggregate, then lets a per-worker configuration override it with
 * {@link #overriddenBy(ProgressConfig)}: options set on the override win, unset ones fall
 * through to the shared value.
 *
 * <pre>{@code
 * ProgressConfig shared = ProgressConfig.builder().description("global ").color(ProgressColor.GREEN).build();
 * ProgressConfig task3 = ProgressConfig.builder().description("task 3 ").build();
 * ProgressConfig merged = shared.overriddenBy(task3); // "task 3 ", GREEN
 * }</pre>
 *
 * <p>Instances are immutable.
 */
public final class ProgressConfig {

    private static final ProgressConfig EMPTY = new ProgressConfig(new Builder());

    private final String description;
    private final ProgressColor color;
    private final Boolean enabled;
    private final PrintStream output;

    private ProgressConfig(Builder builder) {
        this.description = builder.description;
        this.color = builder.color;
        this.enabled = builder.enabled;
        this.output = builder.output;
    }

    /**
     * @return a configuration with no options set
     */
    public static ProgressConfig empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-filled with this configuration's options
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.description = description;
        builder.color = color;
        builder.enabled = enabled;
        builder.output = output;
        return builder;
    }

    /**
     * Merges two configurations.
     *
     * @param override the configuration whose set options take precedence, may be null
     * @return a configuration with the override's set options and this one's for the rest
     */
    public ProgressConfig overriddenBy(ProgressConfig override) {
        if (override == null || override == EMPTY) {
            return this;
        }
        if (this == EMPTY) {
            return override;
        }
        Builder merged = toBuilder();
        if (override.description != null) {
            merged.description = override.description;
        }
        if (override.color != null) {
            merged.color = override.color;
        }
        if (override.enabled != null) {
            merged.enabled = override.enabled;
        }
        if (override.output != null) {
            merged.output = override.output;
        }
        return merged.build();
    }

    /**
     * @param description a replacement description, or {@code null} to keep this one
     * @param color a replacement color, or {@code null} to keep this one
     * @return this configuration with the given style fields replaced
     */
    public ProgressConfig restyled(String description, ProgressColor color) {
        Builder changed = toBuilder();
        if (description != null) {
            changed.description = description;
        }
        if (color != null) {
            changed.color = color;
        }
        return changed.build();
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public Optional<ProgressColor> getColor() {
        return Optional.ofNullable(color);
    }

    public Optional<PrintStream> getOutput() {
        return Optional.ofNullable(output);
    }

    /**
     * @return whether the bar should be drawn; bars are enabled unless configured otherwise
     */
    public boolean isEnabled() {
        return enabled == null || enabled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProgressConfig)) {
            return false;
        }
        ProgressConfig that = (ProgressConfig) o;
        return Objects.equals(description, that.description)
            && color == that.color
            && Objects.equals(enabled, that.enabled)
            && output == that.output;
    }

    @Override
    public int hashCode() {
        return Objects.hash(description, color, enabled, System.identityHashCode(output));
    }

    @Override
    public String toString() {
        return "ProgressConfig{description=" + description
            + ", color=" + color
            + ", enabled=" + enabled
            + ", output=" + (output == null ? "default" : "custom")
            + '}';
    }

    public static final class Builder {
        private String description;
        private ProgressColor color;
        private Boolean enabled;
        private PrintStream output;

        private Builder() {
        }

        public Builder description(String description) {
            this.description = Objects.requireNonNull(description, "description");
            return this;
        }

        public Builder color(ProgressColor color) {
            this.color = Objects.requireNonNull(color, "color");
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder output(PrintStream output) {
            this.output = Objects.requireNonNull(output, "output");
            return this;
        }

        public ProgressConfig build() {
            return new ProgressConfig(this);
        }
    }
}
