package com.flagship.invoice_ledger.eventsourcing.exception;

import java.util.UUID;

/**
 * An append was rejected because the stream is not at the expected version.
 *
 * The caller's view of the aggregate is stale. Reloading and retrying is safe;
 * nothing was written.
 */
public class ConcurrencyConflictException extends EventSourcingException {

    private final UUID streamId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(UUID streamId, long expectedVersion, long actualVersion) {
        super(String.format("Stream %s is at version %d, expected %d",
                streamId, actualVersion, expectedVersion));
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    /**
     * A stream with this id was started concurrently; its version is unknown.
     */
    public ConcurrencyConflictException(UUID streamId, Throwable cause) {
        super(String.format("Stream %s already exists", streamId), cause);
        this.streamId = streamId;
        this.expectedVersion = 0;
        this.actualVersion = -1;
    }

    public UUID getStreamId() {
        return streamId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }

    public boolean isRetryable() {
        return true;
    }
}
