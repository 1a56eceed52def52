package com.cmlarchitect.core.validation;

import java.util.Objects;

/**
 * A single validation finding.
 *
 * @param severity error or warning
 * @param message human-readable description
 * @param location dotted path of the offending element (e.g. {@code Sales.Order}), or the
 *                 name of the element when no path applies
 */
public record Diagnostic(
    Severity severity,
    String message,
    String location
) {
    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    static Diagnostic error(String message, String location) {
        return new Diagnostic(Severity.ERROR, message, location);
    }

    static Diagnostic warning(String message, String location) {
        return new Diagnostic(Severity.WARNING, message, location);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
