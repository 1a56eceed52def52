package com.cmlarchitect.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The document-level map of bounded contexts and their relationships.
 *
 * @param id generated identifier
 * @param name context map name
 * @param type free-form map type such as {@code SYSTEM_LANDSCAPE}; stored, never interpreted
 * @param state as-is snapshot or to-be target
 * @param boundedContexts names of the contained bounded contexts
 * @param relationships relationships between bounded contexts
 */
public record ContextMap(
    String id,
    String name,
    String type,
    ContextMapState state,
    List<String> boundedContexts,
    List<Relationship> relationships
) {
    /** Name used when a document declares an anonymous context map. */
    public static final String DEFAULT_NAME = "MainContextMap";

    /**
     * Compact constructor with validation.
     */
    public ContextMap {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (state == null) {
            state = ContextMapState.AS_IS;
        }
        boundedContexts = boundedContexts == null ? List.of() : List.copyOf(boundedContexts);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }

    /**
     * Returns a copy with one more relationship; the upstream and downstream (or both
     * participants) are added to {@code contains} if they are not listed yet.
     *
     * @param relationship relationship to append
     * @return new context map
     */
    public ContextMap withRelationship(Relationship relationship) {
        List<Relationship> newRelationships = new ArrayList<>(relationships);
        newRelationships.add(relationship);

        List<String> contains = new ArrayList<>(boundedContexts);
        for (String participant : relationship.participants()) {
            if (!contains.contains(participant)) {
                contains.add(participant);
            }
        }
        return new ContextMap(id, name, type, state, contains, newRelationships);
    }
}
