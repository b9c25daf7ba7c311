package com.flagship.invoice_ledger.eventsourcing;

import com.flagship.invoice_ledger.eventsourcing.exception.UnhandledEventKindException;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Folds an aggregate's event stream into its current state.
 *
 * Subclasses supply the zero value of the aggregate and a pure
 * {@link #apply(AggregateRoot, DomainEvent)} per event kind, normally a switch
 * expression over the aggregate's {@link EventKind} enum so that a missing case
 * fails compilation. This class owns everything else:
 * - replay strictly in version order
 * - stamping the version after each event
 * - tracking the tombstone
 * - applying event metadata once, after the last event
 *
 * A tombstone hides the aggregate but does not stop the fold: events appended
 * after it still advance state and version.
 *
 * @param <A> aggregate type
 * @param <E> the aggregate's event family
 */
public abstract class AggregateProjection<A extends AggregateRoot<A>, E extends DomainEvent> {

    private final String aggregateType;
    private final Class<A> aggregateClass;
    private final Class<E> eventType;
    private final Map<String, EventKind> kindsByName;

    protected <K extends Enum<K> & EventKind> AggregateProjection(String aggregateType,
                                                                  Class<A> aggregateClass,
                                                                  Class<E> eventType,
                                                                  Class<K> kinds) {
        this.aggregateType = aggregateType;
        this.aggregateClass = aggregateClass;
        this.eventType = eventType;
        this.kindsByName = Arrays.stream(kinds.getEnumConstants())
                .collect(Collectors.toUnmodifiableMap(EventKind::eventName, Function.identity()));
    }

    /**
     * The state before any event is applied.
     */
    public abstract A initialState(UUID id);

    /**
     * Produces the next state. Must not mutate {@code state}.
     */
    protected abstract A apply(A state, E event);

    /**
     * Stamps timestamps from the last folded event. The creation time is only set
     * while still empty, so after a full replay it holds the first event's time.
     */
    protected A applyMetadata(A state, EventEnvelope lastEvent) {
        A stamped = state;
        if (stamped.getCreatedOn() == null) {
            stamped = stamped.withCreatedOn(lastEvent.getOccurredOn());
        }
        return stamped.withModifiedOn(lastEvent.getOccurredOn());
    }

    /**
     * Rebuilds an aggregate from its complete stream.
     *
     * @return empty when the stream has no events
     * @throws UnhandledEventKindException if an event does not belong to this aggregate type
     */
    public Optional<Projected<A>> replay(UUID id, List<EventEnvelope> envelopes) {
        if (envelopes.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(fold(new Projected<>(initialState(id), 0, false), envelopes));
    }

    /**
     * Continues a fold from an already projected state with newly appended events.
     * Gives the same result as replaying the whole stream.
     *
     * @param current previous result, or null when the stream is new
     */
    public Projected<A> project(UUID id, Projected<A> current, List<EventEnvelope> envelopes) {
        Projected<A> start = current != null ? current : new Projected<>(initialState(id), 0, false);
        if (envelopes.isEmpty()) {
            return start;
        }
        return fold(start, envelopes);
    }

    private Projected<A> fold(Projected<A> start, List<EventEnvelope> envelopes) {
        A state = start.getState();
        long version = start.getVersion();
        boolean deleted = start.isDeleted();

        for (EventEnvelope envelope : envelopes) {
            if (envelope.getVersion() != version + 1) {
                throw new IllegalStateException(String.format(
                        "Stream %s out of order: version %d follows %d",
                        envelope.getStreamId(), envelope.getVersion(), version));
            }
            E event = ownEvent(envelope.getEvent());
            state = apply(state, event).withVersion(envelope.getVersion());
            version = envelope.getVersion();
            deleted = deleted || event.kind().isTombstone();
        }

        state = applyMetadata(state, envelopes.get(envelopes.size() - 1));
        return new Projected<>(state, version, deleted);
    }

    /**
     * Checks that an event belongs to this aggregate type.
     *
     * @throws UnhandledEventKindException otherwise
     */
    public E ownEvent(DomainEvent event) {
        if (!eventType.isInstance(event) || !kindsByName.containsKey(event.kind().eventName())) {
            throw new UnhandledEventKindException(aggregateType, event.getClass().getSimpleName());
        }
        return eventType.cast(event);
    }

    /**
     * Resolves a persisted event name to its payload class.
     *
     * @throws UnhandledEventKindException for names this aggregate does not know
     */
    public Class<? extends DomainEvent> eventClassFor(String eventName) {
        EventKind kind = kindsByName.get(eventName);
        if (kind == null) {
            throw new UnhandledEventKindException(aggregateType, eventName);
        }
        return kind.eventClass();
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public Class<A> getAggregateClass() {
        return aggregateClass;
    }
}
