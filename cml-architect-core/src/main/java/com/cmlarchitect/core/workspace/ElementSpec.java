package com.cmlarchitect.core.workspace;

import com.cmlarchitect.core.model.Attribute;

import java.util.List;
import java.util.Objects;

/**
 * Requested value object, domain event or command.
 *
 * @param name element name, sanitized before use
 * @param attributes attributes to create
 */
public record ElementSpec(
    String name,
    List<Attribute> attributes
) {
    /**
     * Compact constructor with validation.
     */
    public ElementSpec {
        Objects.requireNonNull(name, "name must not be null");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    public static ElementSpec named(String name) {
        return new ElementSpec(name, List.of());
    }
}
