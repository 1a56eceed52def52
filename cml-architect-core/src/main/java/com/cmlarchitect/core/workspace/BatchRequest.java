package com.cmlarchitect.core.workspace;

import java.util.List;
import java.util.Objects;

/**
 * Elements to add to one aggregate in a single atomic step.
 *
 * <p>Identifiers are shorthand for value objects holding a single {@code String value}
 * attribute. Their names are normalized to start upper case and end in {@code Id}, so
 * {@code customer} becomes {@code CustomerId}.
 *
 * @param contextName bounded context owning the aggregate
 * @param aggregateName target aggregate, looked up in modules as well
 * @param identifiers identifier value objects to create
 * @param valueObjects value objects to create
 * @param entities entities to create
 * @param domainEvents domain events to create
 * @param commands commands to create
 * @param services services to create
 */
public record BatchRequest(
    String contextName,
    String aggregateName,
    List<String> identifiers,
    List<ElementSpec> valueObjects,
    List<EntitySpec> entities,
    List<ElementSpec> domainEvents,
    List<ElementSpec> commands,
    List<ServiceSpec> services
) {
    /**
     * Compact constructor with validation.
     */
    public BatchRequest {
        Objects.requireNonNull(contextName, "contextName must not be null");
        Objects.requireNonNull(aggregateName, "aggregateName must not be null");
        identifiers = identifiers == null ? List.of() : List.copyOf(identifiers);
        valueObjects = valueObjects == null ? List.of() : List.copyOf(valueObjects);
        entities = entities == null ? List.of() : List.copyOf(entities);
        domainEvents = domainEvents == null ? List.of() : List.copyOf(domainEvents);
        commands = commands == null ? List.of() : List.copyOf(commands);
        services = services == null ? List.of() : List.copyOf(services);
    }
}
