package com.cmlarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A stateless domain service.
 *
 * @param id generated identifier
 * @param name service name
 * @param operations operations in declaration order
 */
public record DomainService(
    String id,
    String name,
    List<ServiceOperation> operations
) {
    /**
     * Compact constructor with validation.
     */
    public DomainService {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        operations = operations == null ? List.of() : List.copyOf(operations);
    }
}
