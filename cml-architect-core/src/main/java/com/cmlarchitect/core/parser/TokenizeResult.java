package com.cmlarchitect.core.parser;

import java.util.List;

/**
 * Output of {@link CmlTokenizer#tokenize(String)}.
 *
 * @param tokens tokens in source order, whitespace and comments excluded
 * @param errors lexical errors; lexing does not stop at the first one
 */
public record TokenizeResult(
    List<CmlToken> tokens,
    List<SyntaxError> errors
) {
    /**
     * Compact constructor with validation.
     */
    public TokenizeResult {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Returns whether the text was tokenized without errors.
     *
     * @return true if no lexical error occurred
     */
    public boolean isSuccess() {
        return errors.isEmpty();
    }
}
