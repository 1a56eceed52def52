package com.cmlarchitect.core.workspace;

import com.cmlarchitect.core.model.ServiceOperation;

import java.util.List;
import java.util.Objects;

/**
 * Requested domain service.
 *
 * @param name service name, sanitized before use
 * @param operations operations to create
 */
public record ServiceSpec(
    String name,
    List<ServiceOperation> operations
) {
    /**
     * Compact constructor with validation.
     */
    public ServiceSpec {
        Objects.requireNonNull(name, "name must not be null");
        operations = operations == null ? List.of() : List.copyOf(operations);
    }
}
