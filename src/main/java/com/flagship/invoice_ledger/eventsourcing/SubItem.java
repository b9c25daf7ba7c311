package com.flagship.invoice_ledger.eventsourcing;

import java.util.UUID;

/**
 * An entity owned by an aggregate and kept in one of its collections,
 * such as an invoice line item. Identified by id within that collection.
 */
public interface SubItem {

    UUID getId();
}
