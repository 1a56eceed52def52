package com.cmlarchitect.core.writer;

import java.util.Objects;

/**
 * Formatting options for {@link CmlWriter}.
 *
 * @param indent text written once per nesting level, a tab or a run of spaces
 */
public record WriterConfig(String indent) {

    private static final String TAB = "\t";

    /**
     * Compact constructor with validation.
     */
    public WriterConfig {
        Objects.requireNonNull(indent, "indent must not be null");
        if (!indent.equals(TAB) && !indent.chars().allMatch(c -> c == ' ')) {
            throw new IllegalArgumentException("indent must be a tab or spaces, got '" + indent + "'");
        }
    }

    /**
     * Returns the default configuration: one tab per level.
     *
     * @return default writer configuration
     */
    public static WriterConfig defaults() {
        return new WriterConfig(TAB);
    }

    /**
     * Creates a configuration indenting with spaces.
     *
     * @param width number of spaces per level
     * @return writer configuration
     */
    public static WriterConfig spaces(int width) {
        if (width < 1) {
            throw new IllegalArgumentException("indent width must be positive, got " + width);
        }
        return new WriterConfig(" ".repeat(width));
    }
}
