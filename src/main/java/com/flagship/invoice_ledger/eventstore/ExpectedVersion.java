package com.flagship.invoice_ledger.eventstore;

import com.flagship.invoice_ledger.eventsourcing.exception.ConcurrencyConflictException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.UUID;

/**
 * Optimistic concurrency precondition for an append.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExpectedVersion {

    private static final long ANY_VERSION = -1;

    long version;

    /**
     * Append regardless of the current stream version.
     */
    public static ExpectedVersion any() {
        return new ExpectedVersion(ANY_VERSION);
    }

    /**
     * Append only if the stream is exactly at {@code version}.
     */
    public static ExpectedVersion exactly(long version) {
        if (version < 0) {
            throw new IllegalArgumentException("Expected version cannot be negative: " + version);
        }
        return new ExpectedVersion(version);
    }

    public boolean isAny() {
        return version == ANY_VERSION;
    }

    /**
     * @throws ConcurrencyConflictException if {@code actualVersion} does not satisfy this expectation
     */
    public void check(UUID streamId, long actualVersion) {
        if (!isAny() && version != actualVersion) {
            throw new ConcurrencyConflictException(streamId, version, actualVersion);
        }
    }

    @Override
    public String toString() {
        return isAny() ? "any" : String.valueOf(version);
    }
}
