package com.cmlarchitect.core.model;

import java.util.Objects;

/**
 * A typed operation parameter.
 *
 * @param name parameter name
 * @param type parameter type text
 */
public record Parameter(
    String name,
    String type
) {
    /**
     * Compact constructor with validation.
     */
    public Parameter {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}
