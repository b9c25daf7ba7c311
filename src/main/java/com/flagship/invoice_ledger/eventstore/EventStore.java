package com.flagship.invoice_ledger.eventstore;

import com.flagship.invoice_ledger.eventsourcing.AggregateRoot;
import com.flagship.invoice_ledger.eventsourcing.DomainEvent;
import com.flagship.invoice_ledger.eventsourcing.EventEnvelope;
import com.flagship.invoice_ledger.eventsourcing.exception.ConcurrencyConflictException;
import com.flagship.invoice_ledger.eventsourcing.exception.StreamNotFoundException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Append-only event storage with one ordered stream per aggregate instance.
 *
 * Contract:
 * - every call is atomic: either all given events are stored or none
 * - versions within a stream are 1-based, strictly increasing and gapless
 * - the store assigns envelope metadata (version, event name, timestamp)
 * - a materialized view of every stream is refreshed inline on each append,
 *   so queries see the effect of an append as soon as it returns
 *
 * Implementations never leak their own types; repositories see only envelopes,
 * aggregates and the exceptions declared here.
 */
public interface EventStore {

    /**
     * Starts a stream with its first events.
     *
     * @throws ConcurrencyConflictException if a stream with this id already exists
     * @throws IllegalArgumentException if {@code events} is empty
     */
    UUID startStream(String aggregateType, UUID streamId, List<? extends DomainEvent> events);

    /**
     * Appends to an existing stream.
     *
     * @return the stream version after the append
     * @throws StreamNotFoundException if the stream was never started
     * @throws ConcurrencyConflictException if the stream is not at the expected version
     */
    long append(UUID streamId, ExpectedVersion expectedVersion, List<? extends DomainEvent> events);

    /**
     * Full history of a stream in version order; empty for unknown streams.
     * Tombstoned streams keep their history.
     */
    List<EventEnvelope> loadStream(UUID streamId);

    /**
     * Current version of a stream, 0 when it does not exist.
     */
    long streamVersion(UUID streamId);

    /**
     * Current state of every live (not tombstoned) aggregate of one type.
     */
    <A extends AggregateRoot<A>> List<A> queryMaterialized(String aggregateType, Class<A> aggregateClass);

    default <A extends AggregateRoot<A>> List<A> queryMaterialized(String aggregateType,
                                                                  Class<A> aggregateClass,
                                                                  Predicate<? super A> predicate) {
        return queryMaterialized(aggregateType, aggregateClass).stream()
                .filter(predicate)
                .toList();
    }

    /**
     * Materialized state of one live aggregate.
     */
    <A extends AggregateRoot<A>> Optional<A> findMaterialized(UUID streamId, Class<A> aggregateClass);

    /**
     * Number of streams, tombstoned ones included.
     */
    long streamCount();
}
