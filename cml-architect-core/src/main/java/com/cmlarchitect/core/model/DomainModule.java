package com.cmlarchitect.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A CML {@code Module}: a named grouping of aggregates inside a bounded context.
 *
 * <p>Modules are organizational only. Aggregate name uniqueness spans the whole bounded
 * context, modules included.
 *
 * @param id generated identifier
 * @param name module name
 * @param aggregates aggregates of the module
 */
public record DomainModule(
    String id,
    String name,
    List<Aggregate> aggregates
) {
    /**
     * Compact constructor with validation.
     */
    public DomainModule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        aggregates = aggregates == null ? List.of() : List.copyOf(aggregates);
    }

    /**
     * Returns a copy with an aggregate appended.
     *
     * @param aggregate aggregate to append
     * @return new module
     */
    public DomainModule withAggregate(Aggregate aggregate) {
        List<Aggregate> newAggregates = new ArrayList<>(aggregates);
        newAggregates.add(aggregate);
        return new DomainModule(id, name, newAggregates);
    }

    /**
     * Returns a copy in which the aggregate with the same id is replaced.
     *
     * @param aggregate updated aggregate
     * @return new module, or this module when it does not own the aggregate
     */
    public DomainModule replaceAggregate(Aggregate aggregate) {
        return new DomainModule(id, name, aggregates.stream()
            .map(agg -> agg.id().equals(aggregate.id()) ? aggregate : agg)
            .toList());
    }
}
