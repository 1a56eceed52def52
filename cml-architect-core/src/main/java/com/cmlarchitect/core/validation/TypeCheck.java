package com.cmlarchitect.core.validation;

/**
 * Result of validating an attribute type string.
 *
 * @param valid whether the type belongs to the accepted grammar
 * @param kind shape of the type, {@code null} when invalid
 * @param error reason for rejection, {@code null} when valid
 * @param suggestion replacement type to use instead, may be {@code null}
 */
public record TypeCheck(
    boolean valid,
    AttributeTypeKind kind,
    String error,
    String suggestion
) {
    static TypeCheck accepted(AttributeTypeKind kind) {
        return new TypeCheck(true, kind, null, null);
    }

    static TypeCheck rejected(String error, String suggestion) {
        return new TypeCheck(false, null, error, suggestion);
    }
}
