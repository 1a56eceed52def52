package com.cmlarchitect.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Directed relationship in which the upstream context influences the downstream one.
 *
 * @param id generated identifier
 * @param upstream upstream bounded context name
 * @param downstream downstream bounded context name
 * @param upstreamPatterns upstream integration patterns (OHS, PL)
 * @param downstreamPatterns downstream integration patterns (ACL, CF)
 * @param exposedAggregates names of upstream aggregates exposed to the downstream context
 * @param downstreamRights optional influence of the downstream team
 */
public record UpstreamDownstreamRelationship(
    String id,
    String upstream,
    String downstream,
    Set<UpstreamPattern> upstreamPatterns,
    Set<DownstreamPattern> downstreamPatterns,
    List<String> exposedAggregates,
    DownstreamRights downstreamRights
) implements Relationship {
    /**
     * Compact constructor with validation.
     *
     * <p>Pattern sets are copied into {@link EnumSet}s so iteration follows declaration order
     * of the enums, which keeps serialization deterministic.
     */
    public UpstreamDownstreamRelationship {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(upstream, "upstream must not be null");
        Objects.requireNonNull(downstream, "downstream must not be null");
        upstreamPatterns = upstreamPatterns == null || upstreamPatterns.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(upstreamPatterns));
        downstreamPatterns = downstreamPatterns == null || downstreamPatterns.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(downstreamPatterns));
        exposedAggregates = exposedAggregates == null ? List.of() : List.copyOf(exposedAggregates);
    }

    @Override
    public List<String> participants() {
        return List.of(upstream, downstream);
    }

    @Override
    public <R> R match(Function<SymmetricRelationship, R> onSymmetric,
                       Function<UpstreamDownstreamRelationship, R> onUpstreamDownstream) {
        return onUpstreamDownstream.apply(this);
    }
}
