package com.cmlarchitect.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A consistency boundary grouping one root entity with the domain objects it owns.
 *
 * @param id generated identifier
 * @param name aggregate name, unique within its bounded context
 * @param responsibilities responsibility statements
 * @param knowledgeLevel optional knowledge level
 * @param entities entities in declaration order
 * @param valueObjects value objects in declaration order
 * @param domainEvents domain events in declaration order
 * @param commands commands in declaration order
 * @param services domain services in declaration order
 */
public record Aggregate(
    String id,
    String name,
    List<String> responsibilities,
    KnowledgeLevel knowledgeLevel,
    List<Entity> entities,
    List<ValueObject> valueObjects,
    List<DomainEvent> domainEvents,
    List<Command> commands,
    List<DomainService> services
) {
    /**
     * Compact constructor with validation.
     */
    public Aggregate {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        responsibilities = responsibilities == null ? List.of() : List.copyOf(responsibilities);
        entities = entities == null ? List.of() : List.copyOf(entities);
        valueObjects = valueObjects == null ? List.of() : List.copyOf(valueObjects);
        domainEvents = domainEvents == null ? List.of() : List.copyOf(domainEvents);
        commands = commands == null ? List.of() : List.copyOf(commands);
        services = services == null ? List.of() : List.copyOf(services);
    }

    /**
     * Creates an aggregate with only a name.
     *
     * @param id identifier
     * @param name aggregate name
     * @return empty aggregate
     */
    public static Aggregate named(String id, String name) {
        return new Aggregate(id, name, List.of(), null, List.of(), List.of(), List.of(), List.of(), List.of());
    }

    /**
     * Returns the aggregate root: the first entity flagged as root.
     *
     * <p>Documents may flag several entities; only the first is reported here and the
     * cardinality violation is left to the validator.
     *
     * @return the root entity, empty when no entity is flagged
     */
    public Optional<Entity> aggregateRoot() {
        return entities.stream()
            .filter(Entity::aggregateRoot)
            .findFirst();
    }

    /**
     * Returns entities, value objects, domain events and commands in that order.
     *
     * @return all domain objects owned by this aggregate
     */
    public List<DomainObject> domainObjects() {
        return Stream.of(entities, valueObjects, domainEvents, commands)
            .flatMap(List::stream)
            .map(DomainObject.class::cast)
            .toList();
    }

    public Aggregate withEntity(Entity entity) {
        return new Aggregate(id, name, responsibilities, knowledgeLevel,
            append(entities, entity), valueObjects, domainEvents, commands, services);
    }

    public Aggregate withValueObject(ValueObject valueObject) {
        return new Aggregate(id, name, responsibilities, knowledgeLevel,
            entities, append(valueObjects, valueObject), domainEvents, commands, services);
    }

    public Aggregate withDomainEvent(DomainEvent domainEvent) {
        return new Aggregate(id, name, responsibilities, knowledgeLevel,
            entities, valueObjects, append(domainEvents, domainEvent), commands, services);
    }

    public Aggregate withCommand(Command command) {
        return new Aggregate(id, name, responsibilities, knowledgeLevel,
            entities, valueObjects, domainEvents, append(commands, command), services);
    }

    public Aggregate withService(DomainService service) {
        return new Aggregate(id, name, responsibilities, knowledgeLevel,
            entities, valueObjects, domainEvents, commands, append(services, service));
    }

    private static <T> List<T> append(List<T> list, T element) {
        List<T> copy = new ArrayList<>(list);
        copy.add(element);
        return copy;
    }
}
