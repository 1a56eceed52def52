package com.cmlarchitect.core.parser;

import com.cmlarchitect.core.model.CmlModel;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of parsing a CML document.
 *
 * <p>A malformed document is an expected outcome, not an exception: callers branch on
 * {@link #success()} and present {@link #errors()}.
 *
 * @param success whether the document parsed without lexical or syntax errors
 * @param model the built model, {@code null} when parsing failed
 * @param errors every lexical and syntax error found, in source order
 */
public record ParseResult(
    boolean success,
    CmlModel model,
    List<SyntaxError> errors
) {
    /**
     * Compact constructor with validation.
     */
    public ParseResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (success && model == null) {
            throw new IllegalArgumentException("successful parse result requires a model");
        }
    }

    static ParseResult success(CmlModel model) {
        return new ParseResult(true, model, List.of());
    }

    static ParseResult failure(List<SyntaxError> errors) {
        return new ParseResult(false, null, errors);
    }

    /**
     * Returns the model if parsing succeeded.
     *
     * @return optional model
     */
    public Optional<CmlModel> findModel() {
        return Optional.ofNullable(model);
    }
}
