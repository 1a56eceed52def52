package com.cmlarchitect.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * An independently named subdomain boundary; the namespace for aggregates.
 *
 * @param id generated identifier
 * @param name context name, unique within the model
 * @param implementedSubdomains names listed after {@code implements}
 * @param domainVisionStatement optional vision statement
 * @param responsibilities responsibility statements
 * @param implementationTechnology optional informational technology label
 * @param knowledgeLevel optional knowledge level
 * @param aggregates aggregates declared directly in the context
 * @param modules modules grouping further aggregates
 */
public record BoundedContext(
    String id,
    String name,
    List<String> implementedSubdomains,
    String domainVisionStatement,
    List<String> responsibilities,
    String implementationTechnology,
    KnowledgeLevel knowledgeLevel,
    List<Aggregate> aggregates,
    List<DomainModule> modules
) {
    /**
     * Compact constructor with validation.
     */
    public BoundedContext {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        implementedSubdomains = implementedSubdomains == null ? List.of() : List.copyOf(implementedSubdomains);
        responsibilities = responsibilities == null ? List.of() : List.copyOf(responsibilities);
        aggregates = aggregates == null ? List.of() : List.copyOf(aggregates);
        modules = modules == null ? List.of() : List.copyOf(modules);
    }

    /**
     * Creates a bounded context with only a name.
     *
     * @param id identifier
     * @param name context name
     * @return empty bounded context
     */
    public static BoundedContext named(String id, String name) {
        return new BoundedContext(id, name, List.of(), null, List.of(), null, null, List.of(), List.of());
    }

    /**
     * Returns every aggregate of this context, direct ones first, then module aggregates
     * in module order.
     *
     * @return all aggregates
     */
    public List<Aggregate> allAggregates() {
        return Stream.concat(
            aggregates.stream(),
            modules.stream().flatMap(module -> module.aggregates().stream())
        ).toList();
    }

    /**
     * Finds an aggregate by name, searching modules as well.
     *
     * @param aggregateName aggregate name
     * @return matching aggregate
     */
    public Optional<Aggregate> findAggregate(String aggregateName) {
        return allAggregates().stream()
            .filter(agg -> agg.name().equals(aggregateName))
            .findFirst();
    }

    /**
     * Finds a module by name.
     *
     * @param moduleName module name
     * @return matching module
     */
    public Optional<DomainModule> findModule(String moduleName) {
        return modules.stream()
            .filter(module -> module.name().equals(moduleName))
            .findFirst();
    }

    /**
     * Returns a copy with an aggregate appended to the context itself.
     *
     * @param aggregate aggregate to append
     * @return new bounded context
     */
    public BoundedContext withAggregate(Aggregate aggregate) {
        List<Aggregate> newAggregates = new ArrayList<>(aggregates);
        newAggregates.add(aggregate);
        return new BoundedContext(id, name, implementedSubdomains, domainVisionStatement, responsibilities,
            implementationTechnology, knowledgeLevel, newAggregates, modules);
    }

    /**
     * Returns a copy with a module appended or, when a module with the same id exists,
     * replaced.
     *
     * @param module module to add or replace
     * @return new bounded context
     */
    public BoundedContext withModule(DomainModule module) {
        List<DomainModule> newModules = new ArrayList<>(modules);
        boolean replaced = false;
        for (int i = 0; i < newModules.size(); i++) {
            if (newModules.get(i).id().equals(module.id())) {
                newModules.set(i, module);
                replaced = true;
            }
        }
        if (!replaced) {
            newModules.add(module);
        }
        return new BoundedContext(id, name, implementedSubdomains, domainVisionStatement, responsibilities,
            implementationTechnology, knowledgeLevel, aggregates, newModules);
    }

    /**
     * Returns a copy in which the aggregate with the same id is replaced, wherever it lives.
     *
     * @param aggregate updated aggregate
     * @return new bounded context
     */
    public BoundedContext replaceAggregate(Aggregate aggregate) {
        List<Aggregate> newAggregates = aggregates.stream()
            .map(agg -> agg.id().equals(aggregate.id()) ? aggregate : agg)
            .toList();
        List<DomainModule> newModules = modules.stream()
            .map(module -> module.replaceAggregate(aggregate))
            .toList();
        return new BoundedContext(id, name, implementedSubdomains, domainVisionStatement, responsibilities,
            implementationTechnology, knowledgeLevel, newAggregates, newModules);
    }
}
