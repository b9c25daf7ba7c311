package com.flagship.invoice_ledger.invoice;

import com.flagship.invoice_ledger.eventsourcing.SubItem;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Receipt or other document proving an expense booked against an invoice.
 * The content travels inside the event payload.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ExpenseProofFile implements SubItem {

    @Builder.Default
    UUID id = UUID.randomUUID();
    @Builder.Default
    String fileName = "";
    @Builder.Default
    String contentType = "";
    long fileSize;
    @Builder.Default
    byte[] fileContent = new byte[0];
    Instant uploadedAt;
    @Builder.Default
    String description = "";
    @Builder.Default
    BigDecimal amount = BigDecimal.ZERO;
}
