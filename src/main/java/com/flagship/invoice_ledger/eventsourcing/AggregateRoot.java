package com.flagship.invoice_ledger.eventsourcing;

import java.time.Instant;
import java.util.UUID;

/**
 * An entity with a durable identity whose state is rebuilt from its event stream.
 *
 * Aggregates are immutable values. The {@code with*} methods return copies and are
 * called by {@link AggregateProjection} only: the version always equals the number
 * of events applied since creation, and the timestamps come from event metadata.
 *
 * @param <A> the concrete aggregate type
 */
public interface AggregateRoot<A extends AggregateRoot<A>> {

    UUID getId();

    long getVersion();

    Instant getCreatedOn();

    Instant getModifiedOn();

    A withVersion(long version);

    A withCreatedOn(Instant createdOn);

    A withModifiedOn(Instant modifiedOn);
}
