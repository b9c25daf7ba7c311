package com.flagship.invoice_ledger.eventstore;

import com.flagship.invoice_ledger.eventsourcing.AggregateProjection;
import com.flagship.invoice_ledger.eventsourcing.AggregateRoot;
import com.flagship.invoice_ledger.eventsourcing.DomainEvent;
import com.flagship.invoice_ledger.eventsourcing.EventEnvelope;
import com.flagship.invoice_ledger.eventsourcing.Projected;
import com.flagship.invoice_ledger.eventsourcing.ProjectionRegistry;
import com.flagship.invoice_ledger.eventsourcing.exception.ConcurrencyConflictException;
import com.flagship.invoice_ledger.eventsourcing.exception.StreamNotFoundException;
import com.flagship.invoice_ledger.observability.EventStoreMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Event store kept in process memory.
 *
 * Implements the full {@link EventStore} contract, including the inline
 * materialized view, behind a single store-wide lock. Used by tests and for
 * running without a database ({@code event-store.type=memory}).
 */
@Slf4j
public class InMemoryEventStore implements EventStore {

    private final ProjectionRegistry projections;
    private final Clock clock;
    private final EventStoreMetrics metrics;

    private final Map<UUID, StreamState> streams = new HashMap<>();

    public InMemoryEventStore(ProjectionRegistry projections, Clock clock, EventStoreMetrics metrics) {
        this.projections = projections;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public synchronized UUID startStream(String aggregateType, UUID streamId, List<? extends DomainEvent> events) {
        requireEvents(events);
        StreamState existing = streams.get(streamId);
        if (existing != null) {
            throw new ConcurrencyConflictException(streamId, 0, existing.version());
        }
        AggregateProjection<?, ?> projection = projections.forAggregateType(aggregateType);
        events.forEach(projection::ownEvent);

        StreamState stream = new StreamState(aggregateType);
        appendToStream(streamId, stream, projection, events);
        streams.put(streamId, stream);

        log.debug("Started {} stream {} with {} event(s)", aggregateType, streamId, events.size());
        return streamId;
    }

    @Override
    public synchronized long append(UUID streamId, ExpectedVersion expectedVersion,
                                    List<? extends DomainEvent> events) {
        requireEvents(events);
        StreamState stream = streams.get(streamId);
        if (stream == null) {
            throw new StreamNotFoundException(streamId);
        }
        expectedVersion.check(streamId, stream.version());
        AggregateProjection<?, ?> projection = projections.forAggregateType(stream.aggregateType);
        events.forEach(projection::ownEvent);

        appendToStream(streamId, stream, projection, events);

        log.debug("Appended {} event(s) to {} stream {}, now at version {}",
                events.size(), stream.aggregateType, streamId, stream.version());
        return stream.version();
    }

    @Override
    public synchronized List<EventEnvelope> loadStream(UUID streamId) {
        StreamState stream = streams.get(streamId);
        return stream == null ? List.of() : List.copyOf(stream.envelopes);
    }

    @Override
    public synchronized long streamVersion(UUID streamId) {
        StreamState stream = streams.get(streamId);
        return stream == null ? 0 : stream.version();
    }

    @Override
    public synchronized <A extends AggregateRoot<A>> List<A> queryMaterialized(String aggregateType,
                                                                              Class<A> aggregateClass) {
        projections.forAggregateType(aggregateType, aggregateClass);
        return streams.values().stream()
                .filter(stream -> stream.aggregateType.equals(aggregateType))
                .map(stream -> stream.materialized)
                .filter(Projected::isLive)
                .map(projected -> aggregateClass.cast(projected.getState()))
                .toList();
    }

    @Override
    public synchronized <A extends AggregateRoot<A>> Optional<A> findMaterialized(UUID streamId,
                                                                                 Class<A> aggregateClass) {
        return Optional.ofNullable(streams.get(streamId))
                .map(stream -> stream.materialized)
                .filter(Projected::isLive)
                .map(Projected::getState)
                .filter(aggregateClass::isInstance)
                .map(aggregateClass::cast);
    }

    @Override
    public synchronized long streamCount() {
        return streams.size();
    }

    private void appendToStream(UUID streamId, StreamState stream, AggregateProjection<?, ?> projection,
                                List<? extends DomainEvent> events) {
        long version = stream.version();
        List<EventEnvelope> appended = new ArrayList<>(events.size());
        for (DomainEvent event : events) {
            version++;
            appended.add(new EventEnvelope(streamId, stream.aggregateType, event.kind().eventName(),
                    version, clock.instant(), event));
        }
        // Project before mutating so a failing fold leaves the stream untouched
        Projected<?> refreshed = refresh(projection, streamId, stream.materialized, appended);
        stream.envelopes.addAll(appended);
        stream.materialized = refreshed;
        appended.forEach(envelope -> metrics.recordEventAppended(stream.aggregateType, envelope.getEventName()));
    }

    @SuppressWarnings("unchecked")
    private static <A extends AggregateRoot<A>> Projected<A> refresh(AggregateProjection<A, ?> projection,
                                                                    UUID streamId,
                                                                    Projected<?> current,
                                                                    List<EventEnvelope> appended) {
        return projection.project(streamId, (Projected<A>) current, appended);
    }

    private static void requireEvents(List<? extends DomainEvent> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("At least one event is required");
        }
    }

    private static final class StreamState {
        private final String aggregateType;
        private final List<EventEnvelope> envelopes = new ArrayList<>();
        private Projected<?> materialized;

        private StreamState(String aggregateType) {
            this.aggregateType = aggregateType;
        }

        private long version() {
            return envelopes.size();
        }
    }
}
