package com.flagship.invoice_ledger.observability;

import com.flagship.invoice_ledger.eventstore.EventStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EventStoreHealthIndicatorTest {

    private final EventStore eventStore = mock(EventStore.class);
    private final EventStoreHealthIndicator indicator = new EventStoreHealthIndicator(eventStore);

    @Test
    @DisplayName("up with the stream count while the store answers")
    void up() {
        when(eventStore.streamCount()).thenReturn(42L);

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(42L, health.getDetails().get("streams"));
    }

    @Test
    @DisplayName("down with the error when the store cannot be reached")
    void down() {
        when(eventStore.streamCount()).thenThrow(new DataAccessResourceFailureException("Connection refused"));

        Health health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("Connection refused", health.getDetails().get("error"));
    }
}
