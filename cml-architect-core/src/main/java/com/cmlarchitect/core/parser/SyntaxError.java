package com.cmlarchitect.core.parser;

import java.util.Objects;

/**
 * A lexical or syntactic problem found while reading CML text.
 *
 * @param message description of the problem
 * @param line 1-based line number
 * @param column 1-based column number
 */
public record SyntaxError(
    String message,
    int line,
    int column
) {
    /**
     * Compact constructor with validation.
     */
    public SyntaxError {
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return "line " + line + ":" + column + " " + message;
    }
}
