package com.flagship.invoice_ledger.eventstore;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for one event stream and its inline materialized view.
 *
 * The row is the unit of locking: appends take it {@code FOR UPDATE}, check the
 * expected version, insert the events and write back the new version and
 * snapshot in the same transaction.
 *
 * Implements {@link Persistable} so that starting a stream is always an INSERT:
 * a second start for the same id hits the primary key instead of merging.
 */
@Entity
@Table(
    name = "event_streams",
    indexes = {
        @Index(name = "idx_event_streams_type_deleted", columnList = "aggregate_type, deleted")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EventStreamEntity implements Persistable<UUID> {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "aggregate_type", nullable = false, updatable = false, length = 100)
    private String aggregateType;

    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    @Column(name = "snapshot", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String snapshot;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Transient
    private boolean fresh;

    static EventStreamEntity start(UUID id, String aggregateType, Instant now) {
        EventStreamEntity entity = new EventStreamEntity();
        entity.id = id;
        entity.aggregateType = aggregateType;
        entity.version = 0;
        entity.deleted = false;
        entity.createdAt = now;
        entity.updatedAt = now;
        entity.fresh = true;
        return entity;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.fresh = false;
    }

    /**
     * Records the outcome of an append. Versions only move forward.
     */
    void advance(long newVersion, boolean deleted, String snapshot, Instant now) {
        if (newVersion <= this.version) {
            throw new IllegalStateException(String.format(
                    "Stream %s cannot move from version %d to %d", id, this.version, newVersion));
        }
        this.version = newVersion;
        this.deleted = deleted;
        this.snapshot = snapshot;
        this.updatedAt = now;
    }
}
