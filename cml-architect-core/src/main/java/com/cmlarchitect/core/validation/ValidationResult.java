package com.cmlarchitect.core.validation;

import java.util.List;

/**
 * Outcome of validating a model.
 *
 * @param valid true iff no diagnostic has severity {@link Severity#ERROR}
 * @param diagnostics every finding, in rule order
 */
public record ValidationResult(
    boolean valid,
    List<Diagnostic> diagnostics
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationResult {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Creates a result whose validity is derived from the diagnostics.
     *
     * @param diagnostics findings
     * @return validation result
     */
    public static ValidationResult of(List<Diagnostic> diagnostics) {
        boolean valid = diagnostics.stream().noneMatch(Diagnostic::isError);
        return new ValidationResult(valid, diagnostics);
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> d.severity() == Severity.WARNING).toList();
    }
}
