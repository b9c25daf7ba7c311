package com.flagship.invoice_ledger.eventsourcing;

import com.flagship.invoice_ledger.eventsourcing.exception.AggregateValidationException;
import com.flagship.invoice_ledger.eventsourcing.exception.ConcurrencyConflictException;
import com.flagship.invoice_ledger.eventstore.EventStore;
import com.flagship.invoice_ledger.eventstore.ExpectedVersion;
import com.flagship.invoice_ledger.observability.EventStoreMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Load and save protocol shared by every aggregate kind.
 *
 * Reads replay the stream ({@link #getById}) or read the store's materialized view
 * ({@link #getAll}). Writes turn the caller's aggregate into exactly one store call:
 * - {@link #add} starts a stream with the "created" event
 * - {@link #update} appends the full "updated" event, expecting the version the
 *   caller loaded
 * - {@link #delete} appends the tombstone without a version expectation
 *
 * Argument and invariant checks run on the caller's thread and throw before the
 * store is touched. Everything else runs on the executor; store failures complete
 * the returned future exceptionally with the store's exception as cause.
 *
 * @param <A> aggregate type
 * @param <E> the aggregate's event family
 */
@Slf4j
public abstract class AggregateRepository<A extends AggregateRoot<A>, E extends DomainEvent> {

    public static final String AGGREGATE_ID_MDC_KEY = "aggregateId";

    protected final EventStore eventStore;
    protected final AggregateProjection<A, E> projection;
    protected final EventStoreMetrics metrics;
    private final Executor executor;

    protected AggregateRepository(EventStore eventStore,
                                  AggregateProjection<A, E> projection,
                                  Executor executor,
                                  EventStoreMetrics metrics) {
        this.eventStore = eventStore;
        this.projection = projection;
        this.executor = executor;
        this.metrics = metrics;
    }

    /**
     * Invariant violations of the aggregate, empty when it may be persisted.
     */
    protected abstract List<String> validate(A aggregate);

    protected abstract E createdEvent(A aggregate);

    protected abstract E updatedEvent(A aggregate);

    protected abstract E deletedEvent(UUID id);

    /**
     * Order of {@link #getAll()} results.
     */
    protected abstract Comparator<A> displayOrder();

    /**
     * Rebuilds the aggregate from its stream.
     *
     * @return empty if the stream has no events or ends deleted
     */
    public CompletableFuture<Optional<A>> getById(UUID id) {
        requireId(id);
        return CompletableFuture.supplyAsync(() -> load(id), executor);
    }

    /**
     * Every live aggregate of this kind, freshly queried on each call.
     */
    public CompletableFuture<List<A>> getAll() {
        return CompletableFuture.supplyAsync(() -> query(aggregate -> true), executor);
    }

    /**
     * Persists a new aggregate.
     *
     * @return the stream id: the aggregate's own id when set, a fresh one otherwise
     * @throws IllegalArgumentException if {@code aggregate} is null
     * @throws AggregateValidationException if the aggregate violates its invariants
     */
    public CompletableFuture<UUID> add(A aggregate) {
        requireAggregate(aggregate);
        validateOrThrow(aggregate);
        UUID id = aggregate.getId() != null ? aggregate.getId() : UUID.randomUUID();
        E created = createdEvent(aggregate);

        return CompletableFuture.supplyAsync(() -> write(id, () -> {
            eventStore.startStream(getAggregateType(), id, List.of(created));
            log.info("Added {} {}", getAggregateType(), id);
            return id;
        }), executor);
    }

    /**
     * Persists the full current state of a previously loaded aggregate.
     *
     * @return the stream version after the update
     * @throws IllegalArgumentException if the aggregate is null, has no id or was never loaded
     * @throws AggregateValidationException if the aggregate violates its invariants
     */
    public CompletableFuture<Long> update(A aggregate) {
        requireLoaded(aggregate);
        validateOrThrow(aggregate);
        E updated = updatedEvent(aggregate);
        return appendEvents(aggregate.getId(), ExpectedVersion.exactly(aggregate.getVersion()), List.of(updated));
    }

    /**
     * Marks the aggregate deleted. Its history stays readable through {@link #loadStream}.
     */
    public CompletableFuture<Void> delete(UUID id) {
        requireId(id);
        E deleted = deletedEvent(id);
        return appendEvents(id, ExpectedVersion.any(), List.of(deleted))
                .thenApply(version -> null);
    }

    /**
     * Complete event history of one aggregate, tombstone included.
     */
    public CompletableFuture<List<EventEnvelope>> loadStream(UUID id) {
        requireId(id);
        return CompletableFuture.supplyAsync(() -> eventStore.loadStream(id), executor);
    }

    public String getAggregateType() {
        return projection.getAggregateType();
    }

    protected Optional<A> load(UUID id) {
        List<EventEnvelope> envelopes = eventStore.loadStream(id);
        Optional<A> aggregate = metrics.timeReplay(getAggregateType(), () -> projection.replay(id, envelopes))
                .filter(Projected::isLive)
                .map(Projected::getState);
        if (aggregate.isEmpty()) {
            log.warn("{} {} not found", getAggregateType(), id);
        } else {
            log.debug("Loaded {} {} at version {}", getAggregateType(), id, aggregate.get().getVersion());
        }
        return aggregate;
    }

    /**
     * Live aggregates matching the predicate, in display order. Runs on the calling thread.
     */
    protected List<A> query(Predicate<? super A> predicate) {
        List<A> result = eventStore.queryMaterialized(getAggregateType(), projection.getAggregateClass(), predicate)
                .stream()
                .sorted(displayOrder())
                .toList();
        log.debug("Queried {} {} aggregate(s)", result.size(), getAggregateType());
        return result;
    }

    protected CompletableFuture<List<A>> queryAsync(Predicate<? super A> predicate) {
        return CompletableFuture.supplyAsync(() -> query(predicate), executor);
    }

    /**
     * Appends events to an existing stream on the executor.
     *
     * @return future of the stream version after the append
     */
    protected CompletableFuture<Long> appendEvents(UUID id, ExpectedVersion expectedVersion,
                                                   List<? extends E> events) {
        return CompletableFuture.supplyAsync(() -> write(id, () -> {
            long version = eventStore.append(id, expectedVersion, events);
            log.info("Appended {} to {} {}, now at version {}",
                    events.stream().map(event -> event.kind().eventName()).toList(),
                    getAggregateType(), id, version);
            return version;
        }), executor);
    }

    protected void validateOrThrow(A aggregate) {
        List<String> errors = validate(aggregate);
        if (!errors.isEmpty()) {
            metrics.recordValidationFailure(getAggregateType());
            log.error("Cannot persist {} - validation failed: {}", getAggregateType(), String.join(", ", errors));
            throw new AggregateValidationException(getAggregateType(), errors);
        }
    }

    protected static void requireId(UUID id) {
        if (id == null) {
            throw new IllegalArgumentException("Aggregate id is required");
        }
    }

    protected static void requireNotEmpty(Collection<?> values, String what) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException(what + " must not be empty");
        }
    }

    protected void requireLoaded(A aggregate) {
        requireAggregate(aggregate);
        requireId(aggregate.getId());
        if (aggregate.getVersion() <= 0) {
            throw new IllegalArgumentException(String.format(
                    "%s %s has version %d; load it before updating",
                    getAggregateType(), aggregate.getId(), aggregate.getVersion()));
        }
    }

    private void requireAggregate(A aggregate) {
        if (aggregate == null) {
            throw new IllegalArgumentException(getAggregateType() + " is required");
        }
    }

    private <T> T write(UUID id, Supplier<T> operation) {
        MDC.put(AGGREGATE_ID_MDC_KEY, id.toString());
        try {
            return operation.get();
        } catch (ConcurrencyConflictException e) {
            metrics.recordConcurrencyConflict(getAggregateType());
            log.warn("Concurrency conflict on {} {}: {}", getAggregateType(), id, e.getMessage());
            throw e;
        } finally {
            MDC.remove(AGGREGATE_ID_MDC_KEY);
        }
    }
}
