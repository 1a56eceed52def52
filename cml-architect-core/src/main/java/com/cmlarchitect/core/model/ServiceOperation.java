package com.cmlarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An operation ({@code def}) of a domain service or entity.
 *
 * @param name operation name
 * @param returnType return type text; {@code void} when the document omits it
 * @param parameters parameters in declaration order
 */
public record ServiceOperation(
    String name,
    String returnType,
    List<Parameter> parameters
) {
    /** Return type assumed when none is declared. */
    public static final String VOID = "void";

    /**
     * Compact constructor with validation.
     */
    public ServiceOperation {
        Objects.requireNonNull(name, "name must not be null");
        if (returnType == null || returnType.isBlank()) {
            returnType = VOID;
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }
}
