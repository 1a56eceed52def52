package com.cmlarchitect.core.model;

import java.util.List;
import java.util.function.Function;

/**
 * A relationship between two bounded contexts of a context map.
 *
 * <p>The hierarchy is sealed. Consumers branch with {@link #match(Function, Function)}, which
 * forces every call site to handle both shapes without casts.
 */
public sealed interface Relationship permits SymmetricRelationship, UpstreamDownstreamRelationship {

    /**
     * Returns the generated identifier.
     *
     * @return relationship id
     */
    String id();

    /**
     * Returns the referenced bounded context names, in declaration order.
     *
     * @return participant names (always two)
     */
    List<String> participants();

    /**
     * Applies the function matching the concrete relationship shape.
     *
     * @param onSymmetric applied to partnerships and shared kernels
     * @param onUpstreamDownstream applied to upstream-downstream relationships
     * @param <R> result type
     * @return result of the applied function
     */
    <R> R match(Function<SymmetricRelationship, R> onSymmetric,
                Function<UpstreamDownstreamRelationship, R> onUpstreamDownstream);
}
