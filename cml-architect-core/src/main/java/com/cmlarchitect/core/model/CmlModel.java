package com.cmlarchitect.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of a parsed or programmatically built CML document.
 *
 * <p>The model is a tree of records connected by name references. Bounded contexts are
 * referenced from the context map by name, never by pointer, so a model can be validated
 * after it has been assembled from any source.
 *
 * @param name model name (documents carry no name of their own, so parsing uses a default)
 * @param contextMap optional context map, {@code null} when the document declares none
 * @param boundedContexts bounded contexts in declaration order
 */
public record CmlModel(
    String name,
    ContextMap contextMap,
    List<BoundedContext> boundedContexts
) {
    /** Name given to models that come from a document. */
    public static final String DEFAULT_NAME = "Untitled";

    /**
     * Compact constructor with validation.
     */
    public CmlModel {
        Objects.requireNonNull(name, "name must not be null");
        boundedContexts = boundedContexts == null ? List.of() : List.copyOf(boundedContexts);
    }

    /**
     * Creates an empty model.
     *
     * @param name model name
     * @return model without context map and bounded contexts
     */
    public static CmlModel empty(String name) {
        return new CmlModel(name, null, List.of());
    }

    /**
     * Returns the context map if one is declared.
     *
     * @return optional context map
     */
    public Optional<ContextMap> findContextMap() {
        return Optional.ofNullable(contextMap);
    }

    /**
     * Looks up a bounded context by its exact name.
     *
     * @param contextName bounded context name
     * @return first bounded context with that name
     */
    public Optional<BoundedContext> findBoundedContext(String contextName) {
        return boundedContexts.stream()
            .filter(bc -> bc.name().equals(contextName))
            .findFirst();
    }

    /**
     * Returns a copy with the given context map.
     *
     * @param newContextMap replacement context map, may be {@code null}
     * @return new model
     */
    public CmlModel withContextMap(ContextMap newContextMap) {
        return new CmlModel(name, newContextMap, boundedContexts);
    }

    /**
     * Returns a copy with one more bounded context appended.
     *
     * @param boundedContext context to append
     * @return new model
     */
    public CmlModel withBoundedContext(BoundedContext boundedContext) {
        List<BoundedContext> contexts = new ArrayList<>(boundedContexts);
        contexts.add(boundedContext);
        return new CmlModel(name, contextMap, contexts);
    }

    /**
     * Returns a copy in which the bounded context with the same id is replaced.
     *
     * @param boundedContext updated bounded context
     * @return new model
     */
    public CmlModel replaceBoundedContext(BoundedContext boundedContext) {
        List<BoundedContext> contexts = boundedContexts.stream()
            .map(bc -> bc.id().equals(boundedContext.id()) ? boundedContext : bc)
            .toList();
        return new CmlModel(name, contextMap, contexts);
    }
}
