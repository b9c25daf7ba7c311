package com.flagship.invoice_ledger.eventstore;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for event stream rows.
 */
@Repository
public interface EventStreamRepository extends JpaRepository<EventStreamEntity, UUID> {

    /**
     * Loads a stream row with a write lock held until the transaction ends.
     * Serializes concurrent appends to the same stream.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM EventStreamEntity s WHERE s.id = :id")
    Optional<EventStreamEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Live streams of one aggregate type, for materialized queries.
     */
    List<EventStreamEntity> findByAggregateTypeAndDeletedFalse(String aggregateType);

    Optional<EventStreamEntity> findByIdAndDeletedFalse(UUID id);
}
