package com.flagship.invoice_ledger.client;

import com.flagship.invoice_ledger.eventsourcing.EventEnvelope;
import com.flagship.invoice_ledger.eventsourcing.exception.AggregateValidationException;
import com.flagship.invoice_ledger.eventsourcing.exception.ConcurrencyConflictException;
import com.flagship.invoice_ledger.eventsourcing.exception.StreamNotFoundException;
import com.flagship.invoice_ledger.support.InMemoryLedger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletionException;

import static com.flagship.invoice_ledger.support.Fixtures.company;
import static com.flagship.invoice_ledger.support.Fixtures.individual;
import static org.junit.jupiter.api.Assertions.*;

class ClientRepositoryTest {

    private final InMemoryLedger ledger = new InMemoryLedger();
    private final ClientRepository repository = ledger.clients;

    private Client load(UUID id) {
        return repository.getById(id).join().orElseThrow();
    }

    @Nested
    @DisplayName("Add and update")
    class AddAndUpdate {

        @Test
        @DisplayName("a renamed client keeps its id and gains a version")
        void renameScenario() {
            UUID id = repository.add(individual("John", "Anderson")).join();

            Client added = load(id);
            assertEquals("Anderson", added.getLastName());
            assertEquals(1, added.getVersion());

            ledger.clock.advance(Duration.ofDays(1));
            long version = repository.update(added.withLastName("Smith")).join();

            Client updated = load(id);
            assertEquals(2, version);
            assertEquals("Smith", updated.getLastName());
            assertEquals("John Smith", updated.getFullName());
            assertEquals(2, updated.getVersion());
            assertEquals(added.getCreatedOn(), updated.getCreatedOn());
            assertEquals(InMemoryLedger.START.plus(Duration.ofDays(1)), updated.getModifiedOn());
            assertEquals(List.of("ClientCreated", "ClientUpdated"), repository.loadStream(id).join().stream()
                    .map(EventEnvelope::getEventName)
                    .toList());
        }

        @Test
        @DisplayName("each update appends one event and leaves earlier events untouched")
        void twoUpdates() {
            UUID id = repository.add(individual("John", "Anderson")).join();
            ledger.clock.advance(Duration.ofHours(1));
            repository.update(load(id).withLastName("Smith")).join();
            List<EventEnvelope> beforeSecondUpdate = repository.loadStream(id).join();

            ledger.clock.advance(Duration.ofHours(1));
            long version = repository.update(load(id).withEmail("john.smith@example.com")).join();

            List<EventEnvelope> stream = repository.loadStream(id).join();
            assertEquals(3, version);
            assertEquals(List.of("ClientCreated", "ClientUpdated", "ClientUpdated"), stream.stream()
                    .map(EventEnvelope::getEventName)
                    .toList());
            assertEquals(List.of(1L, 2L, 3L), stream.stream()
                    .map(EventEnvelope::getVersion)
                    .toList());
            assertEquals(beforeSecondUpdate, stream.subList(0, 2));
            assertEquals("Smith", load(id).getLastName());
            assertEquals("john.smith@example.com", load(id).getEmail());
        }

        @Test
        @DisplayName("the client's own id becomes the stream id")
        void usesOwnId() {
            UUID id = UUID.randomUUID();

            assertEquals(id, repository.add(individual("Maria", "Huber").withId(id)).join());
            assertTrue(repository.getById(id).join().isPresent());
        }

        @Test
        @DisplayName("an unknown id is not found")
        void unknownId() {
            assertTrue(repository.getById(UUID.randomUUID()).join().isEmpty());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("an invalid client is rejected before anything is appended")
        void rejectedBeforeAppend() {
            Client invalid = individual("John", "").withPhoneNumber(" ");

            AggregateValidationException e = assertThrows(AggregateValidationException.class,
                    () -> repository.add(invalid));

            assertEquals(List.of("Phone number is required.", "Last name is required for individual clients."),
                    e.getErrors());
            assertEquals(0, ledger.store.streamCount());
            assertEquals(1.0, ledger.meterRegistry.get("eventstore.validation.failures").counter().count());
        }

        @Test
        @DisplayName("a company needs a company name but no personal names")
        void companyRules() {
            Client nameless = company("Acme").withCompanyName(null);

            AggregateValidationException e = assertThrows(AggregateValidationException.class,
                    () -> repository.add(nameless));
            assertEquals(List.of("Company name is required for company clients."), e.getErrors());
            assertDoesNotThrow(() -> repository.add(company("Acme")).join());
        }

        @Test
        @DisplayName("a missing client is an argument error")
        void nullClient() {
            assertThrows(IllegalArgumentException.class, () -> repository.add(null));
        }

        @Test
        @DisplayName("an update must start from a loaded client")
        void updateNeedsLoadedClient() {
            assertThrows(IllegalArgumentException.class,
                    () -> repository.update(individual("John", "Anderson").withId(UUID.randomUUID())));
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("the second update from the same loaded version conflicts")
        void secondWriterConflicts() {
            UUID id = repository.add(individual("John", "Anderson")).join();
            Client first = load(id);
            Client second = load(id);

            repository.update(first.withLastName("Smith")).join();
            CompletionException e = assertThrows(CompletionException.class,
                    () -> repository.update(second.withLastName("Miller")).join());

            ConcurrencyConflictException conflict = assertInstanceOf(ConcurrencyConflictException.class, e.getCause());
            assertEquals(1, conflict.getExpectedVersion());
            assertEquals(2, conflict.getActualVersion());
            assertEquals("Smith", load(id).getLastName());
            assertEquals(1.0, ledger.meterRegistry.get("eventstore.concurrency.conflicts").counter().count());
        }

        @Test
        @DisplayName("updating a stream that was never started fails")
        void updateUnknownStream() {
            Client ghost = individual("John", "Anderson").withId(UUID.randomUUID()).withVersion(1);

            CompletionException e = assertThrows(CompletionException.class, () -> repository.update(ghost).join());
            assertInstanceOf(StreamNotFoundException.class, e.getCause());
        }
    }

    @Nested
    @DisplayName("Delete")
    class Delete {

        @Test
        @DisplayName("a deleted client disappears from reads but keeps its history")
        void deleteHidesClient() {
            UUID id = repository.add(individual("John", "Anderson")).join();
            UUID other = repository.add(individual("Maria", "Huber")).join();

            repository.delete(id).join();

            assertTrue(repository.getById(id).join().isEmpty());
            assertEquals(List.of(other), repository.getAll().join().stream().map(Client::getId).toList());
            assertEquals(List.of("ClientCreated", "ClientDeleted"), repository.loadStream(id).join().stream()
                    .map(EventEnvelope::getEventName)
                    .toList());
        }

        @Test
        @DisplayName("deleting an unknown client fails")
        void deleteUnknown() {
            CompletionException e = assertThrows(CompletionException.class,
                    () -> repository.delete(UUID.randomUUID()).join());
            assertInstanceOf(StreamNotFoundException.class, e.getCause());
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("all clients are ordered by display name")
        void orderedByDisplayName() {
            repository.add(individual("Zoe", "Adler")).join();
            repository.add(company("Acme Bau")).join();
            repository.add(individual("bernd", "Berger")).join();

            assertEquals(List.of("Acme Bau", "bernd Berger", "Zoe Adler"),
                    repository.getAllClients().join().stream().map(Client::getDisplayName).toList());
        }

        @Test
        @DisplayName("search matches names, company name and email ignoring case")
        void search() {
            repository.add(individual("John", "Smith")).join();
            repository.add(individual("Maria", "Huber")).join();
            repository.add(company("Smithson Bau")).join();

            assertEquals(List.of("John Smith", "Smithson Bau"),
                    repository.findClients("SMITH").join().stream().map(Client::getDisplayName).toList());
            assertEquals(List.of("Maria Huber"),
                    repository.findClients("maria@example").join().stream().map(Client::getDisplayName).toList());
            assertEquals(3, repository.findClients("  ").join().size());
        }
    }
}
