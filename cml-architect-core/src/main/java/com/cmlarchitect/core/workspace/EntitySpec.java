package com.cmlarchitect.core.workspace;

import com.cmlarchitect.core.model.Attribute;

import java.util.List;
import java.util.Objects;

/**
 * Requested entity.
 *
 * @param name entity name, sanitized before use
 * @param aggregateRoot whether the entity becomes the aggregate root
 * @param attributes attributes to create
 */
public record EntitySpec(
    String name,
    boolean aggregateRoot,
    List<Attribute> attributes
) {
    /**
     * Compact constructor with validation.
     */
    public EntitySpec {
        Objects.requireNonNull(name, "name must not be null");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }
}
