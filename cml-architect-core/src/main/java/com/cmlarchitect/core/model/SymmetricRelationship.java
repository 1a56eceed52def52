package com.cmlarchitect.core.model;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Partnership or shared kernel between two bounded contexts.
 *
 * @param id generated identifier
 * @param type partnership or shared kernel
 * @param participant1 first bounded context name
 * @param participant2 second bounded context name
 */
public record SymmetricRelationship(
    String id,
    SymmetricRelationshipType type,
    String participant1,
    String participant2
) implements Relationship {
    /**
     * Compact constructor with validation.
     */
    public SymmetricRelationship {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(participant1, "participant1 must not be null");
        Objects.requireNonNull(participant2, "participant2 must not be null");
    }

    @Override
    public List<String> participants() {
        return List.of(participant1, participant2);
    }

    @Override
    public <R> R match(Function<SymmetricRelationship, R> onSymmetric,
                       Function<UpstreamDownstreamRelationship, R> onUpstreamDownstream) {
        return onSymmetric.apply(this);
    }
}
