package com.flagship.invoice_ledger.eventstore;

import com.flagship.invoice_ledger.eventsourcing.DomainEvent;
import com.flagship.invoice_ledger.eventsourcing.EventEnvelope;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for one appended event. Rows are written once and never updated.
 *
 * The unique (stream_id, version) constraint backs the gapless ordering
 * guarantee at the database level.
 */
@Entity
@Immutable
@Table(
    name = "events",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_events_stream_version", columnNames = {"stream_id", "version"})
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StoredEventEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "stream_id", nullable = false, updatable = false)
    private UUID streamId;

    @Column(name = "version", nullable = false, updatable = false)
    private long version;

    @Column(name = "aggregate_type", nullable = false, updatable = false, length = 100)
    private String aggregateType;

    @Column(name = "event_name", nullable = false, updatable = false, length = 100)
    private String eventName;

    @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String payload;

    @Column(name = "occurred_on", nullable = false, updatable = false)
    private Instant occurredOn;

    static StoredEventEntity fromEnvelope(EventEnvelope envelope, String payload) {
        return new StoredEventEntity(
            UUID.randomUUID(),
            envelope.getStreamId(),
            envelope.getVersion(),
            envelope.getAggregateType(),
            envelope.getEventName(),
            payload,
            envelope.getOccurredOn()
        );
    }

    EventEnvelope toEnvelope(DomainEvent event) {
        return new EventEnvelope(streamId, aggregateType, eventName, version, occurredOn, event);
    }
}
