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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL event store built on Spring Data JPA.
 *
 * Layout:
 * - {@code events}: one immutable row per event, JSON payload
 * - {@code event_streams}: one row per stream holding its version, tombstone flag
 *   and the JSON snapshot of the materialized aggregate
 *
 * Every public method is one transaction. An append locks the stream row, checks
 * the expected version, inserts the events and refreshes the snapshot before
 * commit, so the materialized view never lags the event log.
 */
@Service
@ConditionalOnProperty(name = "event-store.type", havingValue = "jpa", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JpaEventStore implements EventStore {

    private final EventStreamRepository streamRepository;
    private final StoredEventRepository eventRepository;
    private final ProjectionRegistry projections;
    private final EventSerializer serializer;
    private final EventStoreMetrics metrics;
    private final Clock clock;

    @Override
    @Transactional
    public UUID startStream(String aggregateType, UUID streamId, List<? extends DomainEvent> events) {
        requireEvents(events);
        Optional<EventStreamEntity> existing = streamRepository.findById(streamId);
        if (existing.isPresent()) {
            throw new ConcurrencyConflictException(streamId, 0, existing.get().getVersion());
        }
        AggregateProjection<?, ?> projection = projections.forAggregateType(aggregateType);
        events.forEach(projection::ownEvent);

        EventStreamEntity stream = EventStreamEntity.start(streamId, aggregateType, clock.instant());
        try {
            streamRepository.saveAndFlush(stream);
        } catch (DataIntegrityViolationException e) {
            // Lost the race against another startStream for the same id
            throw new ConcurrencyConflictException(streamId, e);
        }
        appendToStream(stream, projection, events);

        log.debug("Started {} stream {} with {} event(s)", aggregateType, streamId, events.size());
        return streamId;
    }

    @Override
    @Transactional
    public long append(UUID streamId, ExpectedVersion expectedVersion, List<? extends DomainEvent> events) {
        requireEvents(events);
        EventStreamEntity stream = streamRepository.findByIdForUpdate(streamId)
                .orElseThrow(() -> new StreamNotFoundException(streamId));
        expectedVersion.check(streamId, stream.getVersion());
        AggregateProjection<?, ?> projection = projections.forAggregateType(stream.getAggregateType());
        events.forEach(projection::ownEvent);

        appendToStream(stream, projection, events);

        log.debug("Appended {} event(s) to {} stream {}, now at version {}",
                events.size(), stream.getAggregateType(), streamId, stream.getVersion());
        return stream.getVersion();
    }

    @Override
    @Transactional(readOnly = true)
    public List<EventEnvelope> loadStream(UUID streamId) {
        List<StoredEventEntity> rows = eventRepository.findByStreamIdOrderByVersionAsc(streamId);
        if (rows.isEmpty()) {
            return List.of();
        }
        AggregateProjection<?, ?> projection = projections.forAggregateType(rows.get(0).getAggregateType());
        return rows.stream()
                .map(row -> row.toEnvelope(serializer.deserialize(row.getPayload(),
                        projection.eventClassFor(row.getEventName()))))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long streamVersion(UUID streamId) {
        return streamRepository.findById(streamId)
                .map(EventStreamEntity::getVersion)
                .orElse(0L);
    }

    @Override
    @Transactional(readOnly = true)
    public <A extends AggregateRoot<A>> List<A> queryMaterialized(String aggregateType, Class<A> aggregateClass) {
        projections.forAggregateType(aggregateType, aggregateClass);
        return streamRepository.findByAggregateTypeAndDeletedFalse(aggregateType).stream()
                .map(stream -> serializer.deserialize(stream.getSnapshot(), aggregateClass))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public <A extends AggregateRoot<A>> Optional<A> findMaterialized(UUID streamId, Class<A> aggregateClass) {
        return streamRepository.findByIdAndDeletedFalse(streamId)
                .filter(stream -> projections.forAggregateType(stream.getAggregateType())
                        .getAggregateClass().equals(aggregateClass))
                .map(stream -> serializer.deserialize(stream.getSnapshot(), aggregateClass));
    }

    @Override
    @Transactional(readOnly = true)
    public long streamCount() {
        return streamRepository.count();
    }

    private void appendToStream(EventStreamEntity stream, AggregateProjection<?, ?> projection,
                                List<? extends DomainEvent> events) {
        Instant now = clock.instant();
        long version = stream.getVersion();
        List<EventEnvelope> appended = new ArrayList<>(events.size());
        List<StoredEventEntity> rows = new ArrayList<>(events.size());
        for (DomainEvent event : events) {
            version++;
            EventEnvelope envelope = new EventEnvelope(stream.getId(), stream.getAggregateType(),
                    event.kind().eventName(), version, now, event);
            appended.add(envelope);
            rows.add(StoredEventEntity.fromEnvelope(envelope, serializer.serialize(event)));
        }

        Projected<?> refreshed = refresh(projection, stream, appended);
        eventRepository.saveAll(rows);
        stream.advance(refreshed.getVersion(), refreshed.isDeleted(),
                serializer.serialize(refreshed.getState()), now);
        streamRepository.save(stream);

        appended.forEach(envelope -> metrics.recordEventAppended(stream.getAggregateType(), envelope.getEventName()));
    }

    private <A extends AggregateRoot<A>> Projected<A> refresh(AggregateProjection<A, ?> projection,
                                                             EventStreamEntity stream,
                                                             List<EventEnvelope> appended) {
        Projected<A> current = null;
        if (stream.getVersion() > 0) {
            A state = serializer.deserialize(stream.getSnapshot(), projection.getAggregateClass());
            current = new Projected<>(state, stream.getVersion(), stream.isDeleted());
        }
        return projection.project(stream.getId(), current, appended);
    }

    private static void requireEvents(List<? extends DomainEvent> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("At least one event is required");
        }
    }
}
