package com.flagship.invoice_ledger.eventsourcing.exception;

import java.util.UUID;

/**
 * An append targeted a stream that was never started.
 */
public class StreamNotFoundException extends EventSourcingException {

    private final UUID streamId;

    public StreamNotFoundException(UUID streamId) {
        super("Event stream not found: " + streamId);
        this.streamId = streamId;
    }

    public UUID getStreamId() {
        return streamId;
    }
}
