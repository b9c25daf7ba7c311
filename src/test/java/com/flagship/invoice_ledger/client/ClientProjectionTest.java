package com.flagship.invoice_ledger.client;

import com.flagship.invoice_ledger.client.event.ClientCreated;
import com.flagship.invoice_ledger.client.event.ClientDeleted;
import com.flagship.invoice_ledger.client.event.ClientUpdated;
import com.flagship.invoice_ledger.eventsourcing.DomainEvent;
import com.flagship.invoice_ledger.eventsourcing.EventEnvelope;
import com.flagship.invoice_ledger.eventsourcing.Projected;
import com.flagship.invoice_ledger.eventsourcing.exception.UnhandledEventKindException;
import com.flagship.invoice_ledger.invoice.event.InvoiceDeleted;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.flagship.invoice_ledger.support.Fixtures.company;
import static com.flagship.invoice_ledger.support.Fixtures.individual;
import static org.junit.jupiter.api.Assertions.*;

class ClientProjectionTest {

    private static final Instant T0 = Instant.parse("2025-01-15T08:00:00Z");

    private final ClientProjection projection = new ClientProjection();
    private final UUID id = UUID.randomUUID();

    private List<EventEnvelope> stream(DomainEvent... events) {
        List<EventEnvelope> envelopes = new ArrayList<>();
        for (int i = 0; i < events.length; i++) {
            DomainEvent event = events[i];
            envelopes.add(new EventEnvelope(id, ClientProjection.AGGREGATE_TYPE, event.kind().eventName(),
                    i + 1, T0.plus(Duration.ofHours(i)), event));
        }
        return envelopes;
    }

    private Projected<Client> replay(List<EventEnvelope> envelopes) {
        return projection.replay(id, envelopes).orElseThrow();
    }

    @Nested
    @DisplayName("Folding")
    class Folding {

        @Test
        @DisplayName("replaying the same stream twice gives equal results")
        void replayIsDeterministic() {
            List<EventEnvelope> envelopes = stream(
                    ClientCreated.of(individual("John", "Anderson")),
                    ClientUpdated.of(individual("John", "Smith")));

            assertEquals(replay(envelopes), replay(envelopes));
        }

        @Test
        @DisplayName("version counts the events and timestamps come from the first and last event")
        void versionAndMetadata() {
            Projected<Client> result = replay(stream(
                    ClientCreated.of(individual("John", "Anderson")),
                    ClientUpdated.of(individual("John", "Smith")),
                    ClientUpdated.of(individual("Jon", "Smith"))));

            Client client = result.getState();
            assertEquals(3, result.getVersion());
            assertEquals(3, client.getVersion());
            assertEquals(id, client.getId());
            assertEquals("Jon", client.getFirstName());
            assertEquals(T0, client.getCreatedOn());
            assertEquals(T0.plus(Duration.ofHours(2)), client.getModifiedOn());
        }

        @Test
        @DisplayName("company fields are applied on creation")
        void companyFieldsOnCreate() {
            Client client = replay(stream(ClientCreated.of(company("Acme Bau GmbH")))).getState();

            assertTrue(client.isCompany());
            assertEquals("Acme Bau GmbH", client.getCompanyName());
            assertEquals("Acme Bau GmbH", client.getDisplayName());
        }

        @Test
        @DisplayName("continuing from a projected state equals a full replay")
        void incrementalEqualsReplay() {
            List<EventEnvelope> envelopes = stream(
                    ClientCreated.of(individual("John", "Anderson")),
                    ClientUpdated.of(individual("John", "Smith")),
                    new ClientDeleted(id));

            Projected<Client> first = projection.project(id, null, envelopes.subList(0, 1));
            Projected<Client> continued = projection.project(id, first, envelopes.subList(1, 3));

            assertEquals(replay(envelopes), continued);
        }

        @Test
        @DisplayName("a stream without events has no aggregate")
        void emptyStream() {
            assertTrue(projection.replay(id, List.of()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Tombstone")
    class Tombstone {

        @Test
        @DisplayName("marks the aggregate deleted")
        void marksDeleted() {
            Projected<Client> result = replay(stream(
                    ClientCreated.of(individual("John", "Anderson")),
                    new ClientDeleted(id)));

            assertTrue(result.isDeleted());
            assertFalse(result.isLive());
            assertEquals(2, result.getVersion());
        }

        @Test
        @DisplayName("later events still fold but the aggregate stays deleted")
        void stickyAfterTombstone() {
            Projected<Client> result = replay(stream(
                    ClientCreated.of(individual("John", "Anderson")),
                    new ClientDeleted(id),
                    ClientUpdated.of(individual("John", "Smith"))));

            assertTrue(result.isDeleted());
            assertEquals(3, result.getVersion());
            assertEquals("Smith", result.getState().getLastName());
        }
    }

    @Nested
    @DisplayName("Unknown events")
    class UnknownEvents {

        @Test
        @DisplayName("an event of another aggregate fails the replay")
        void foreignEvent() {
            List<EventEnvelope> envelopes = stream(
                    ClientCreated.of(individual("John", "Anderson")),
                    new InvoiceDeleted(id));

            UnhandledEventKindException e = assertThrows(UnhandledEventKindException.class, () -> replay(envelopes));
            assertEquals("Client", e.getAggregateType());
        }

        @Test
        @DisplayName("an unknown stored event name cannot be resolved")
        void unknownEventName() {
            assertEquals(ClientUpdated.class, projection.eventClassFor("ClientUpdated"));
            assertThrows(UnhandledEventKindException.class, () -> projection.eventClassFor("ClientArchived"));
        }

        @Test
        @DisplayName("envelopes out of version order are rejected")
        void outOfOrder() {
            List<EventEnvelope> envelopes = new ArrayList<>(stream(
                    ClientCreated.of(individual("John", "Anderson")),
                    ClientUpdated.of(individual("John", "Smith"))));
            envelopes.remove(0);

            assertThrows(IllegalStateException.class, () -> replay(envelopes));
        }
    }
}
