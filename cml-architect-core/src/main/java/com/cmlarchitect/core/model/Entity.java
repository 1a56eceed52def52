package com.cmlarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A domain object with identity.
 *
 * @param id generated identifier
 * @param name entity name, unique across the whole model
 * @param aggregateRoot whether the entity is marked {@code aggregateRoot}
 * @param attributes attributes in declaration order
 * @param operations operations in declaration order
 */
public record Entity(
    String id,
    String name,
    boolean aggregateRoot,
    List<Attribute> attributes,
    List<ServiceOperation> operations
) implements DomainObject {
    /**
     * Compact constructor with validation.
     */
    public Entity {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        operations = operations == null ? List.of() : List.copyOf(operations);
    }

    @Override
    public DomainObjectKind kind() {
        return DomainObjectKind.ENTITY;
    }
}
