package com.cmlarchitect.core.parser;

import java.util.Objects;

/**
 * A token of CML source text.
 *
 * @param type symbolic token type, e.g. {@code ENTITY}, {@code ID}, {@code ARROW}
 * @param text matched text
 * @param line 1-based line number
 * @param column 1-based column number
 */
public record CmlToken(
    String type,
    String text,
    int line,
    int column
) {
    /**
     * Compact constructor with validation.
     */
    public CmlToken {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Returns whether this token is a generic identifier rather than a keyword or symbol.
     *
     * @return true for identifiers
     */
    public boolean isIdentifier() {
        return CmlTokenizer.IDENTIFIER.equals(type);
    }
}
