package com.cmlarchitect.core.model;

import java.util.Objects;

/**
 * An attribute of an entity, value object, domain event or command.
 *
 * <p>The name is stored unescaped; {@code ^} escaping is applied only when writing CML.
 *
 * @param name attribute name
 * @param type type text: a primitive or reference name, {@code List<T>}, {@code Set<T>},
 *             or an explicit reference {@code - T}
 * @param key whether the attribute is marked {@code key}
 * @param nullable whether the attribute is marked {@code nullable}
 */
public record Attribute(
    String name,
    String type,
    boolean key,
    boolean nullable
) {
    /**
     * Compact constructor with validation.
     */
    public Attribute {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    /**
     * Creates a plain attribute without modifiers.
     *
     * @param name attribute name
     * @param type attribute type
     * @return attribute
     */
    public static Attribute of(String name, String type) {
        return new Attribute(name, type, false, false);
    }
}
