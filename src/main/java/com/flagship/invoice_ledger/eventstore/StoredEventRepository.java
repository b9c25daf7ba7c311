package com.flagship.invoice_ledger.eventstore;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for appended events.
 */
@Repository
public interface StoredEventRepository extends JpaRepository<StoredEventEntity, UUID> {

    List<StoredEventEntity> findByStreamIdOrderByVersionAsc(UUID streamId);
}
