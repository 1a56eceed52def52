package com.cmlarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A named, attributed message requesting an action.
 *
 * @param id generated identifier
 * @param name name, unique across the whole model
 * @param attributes attributes in declaration order
 */
public record Command(
    String id,
    String name,
    List<Attribute> attributes
) implements DomainObject {
    /**
     * Compact constructor with validation.
     */
    public Command {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    @Override
    public DomainObjectKind kind() {
        return DomainObjectKind.COMMAND;
    }
}
