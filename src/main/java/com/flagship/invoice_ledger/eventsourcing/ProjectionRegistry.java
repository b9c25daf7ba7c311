package com.flagship.invoice_ledger.eventsourcing;

import com.flagship.invoice_ledger.eventsourcing.exception.UnhandledEventKindException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lookup of the projection responsible for each aggregate type.
 *
 * Event stores use it to deserialize stored events and to keep their
 * materialized views current on every append.
 */
public class ProjectionRegistry {

    private final Map<String, AggregateProjection<?, ?>> projections;

    public ProjectionRegistry(Collection<? extends AggregateProjection<?, ?>> projections) {
        this.projections = projections.stream()
                .collect(Collectors.toUnmodifiableMap(
                        AggregateProjection::getAggregateType, Function.identity()));
    }

    public static ProjectionRegistry of(AggregateProjection<?, ?>... projections) {
        return new ProjectionRegistry(List.of(projections));
    }

    /**
     * @throws UnhandledEventKindException when no projection is registered for the type
     */
    public AggregateProjection<?, ?> forAggregateType(String aggregateType) {
        AggregateProjection<?, ?> projection = projections.get(aggregateType);
        if (projection == null) {
            throw new UnhandledEventKindException(aggregateType, "<any>");
        }
        return projection;
    }

    /**
     * Same as {@link #forAggregateType(String)} but checked against the expected
     * aggregate class.
     */
    @SuppressWarnings("unchecked")
    public <A extends AggregateRoot<A>> AggregateProjection<A, ?> forAggregateType(String aggregateType,
                                                                                  Class<A> aggregateClass) {
        AggregateProjection<?, ?> projection = forAggregateType(aggregateType);
        if (!projection.getAggregateClass().equals(aggregateClass)) {
            throw new IllegalArgumentException(String.format(
                    "Aggregate type %s materializes %s, not %s",
                    aggregateType, projection.getAggregateClass().getSimpleName(),
                    aggregateClass.getSimpleName()));
        }
        return (AggregateProjection<A, ?>) projection;
    }
}
