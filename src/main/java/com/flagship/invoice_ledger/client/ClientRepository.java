package com.flagship.invoice_ledger.client;

import com.flagship.invoice_ledger.client.event.ClientCreated;
import com.flagship.invoice_ledger.client.event.ClientDeleted;
import com.flagship.invoice_ledger.client.event.ClientEvent;
import com.flagship.invoice_ledger.client.event.ClientUpdated;
import com.flagship.invoice_ledger.eventsourcing.AggregateRepository;
import com.flagship.invoice_ledger.eventstore.EventStore;
import com.flagship.invoice_ledger.observability.EventStoreMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Persistence of clients as event streams.
 */
@Component
@Slf4j
public class ClientRepository extends AggregateRepository<Client, ClientEvent> {

    public ClientRepository(EventStore eventStore,
                            ClientProjection projection,
                            @Qualifier("eventStoreExecutor") Executor executor,
                            EventStoreMetrics metrics) {
        super(eventStore, projection, executor, metrics);
    }

    /**
     * All live clients ordered by display name.
     */
    public CompletableFuture<List<Client>> getAllClients() {
        return getAll();
    }

    /**
     * Clients whose first, last or company name or email contains the text,
     * ignoring case. Blank text matches every client.
     */
    public CompletableFuture<List<Client>> findClients(String searchText) {
        if (searchText == null || searchText.isBlank()) {
            return getAll();
        }
        String needle = searchText.trim().toLowerCase(Locale.ROOT);
        log.debug("Searching clients for '{}'", needle);
        return queryAsync(client -> matches(client, needle));
    }

    /**
     * Whether the client's names or email contain the already lower-cased text.
     */
    public static boolean matches(Client client, String lowerCaseText) {
        return containsIgnoreCase(client.getFirstName(), lowerCaseText)
                || containsIgnoreCase(client.getLastName(), lowerCaseText)
                || containsIgnoreCase(client.getCompanyName(), lowerCaseText)
                || containsIgnoreCase(client.getEmail(), lowerCaseText);
    }

    private static boolean containsIgnoreCase(String value, String lowerCaseText) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(lowerCaseText);
    }

    @Override
    protected List<String> validate(Client client) {
        return client.validationErrors();
    }

    @Override
    protected ClientEvent createdEvent(Client client) {
        return ClientCreated.of(client);
    }

    @Override
    protected ClientEvent updatedEvent(Client client) {
        return ClientUpdated.of(client);
    }

    @Override
    protected ClientEvent deletedEvent(UUID id) {
        return new ClientDeleted(id);
    }

    @Override
    protected Comparator<Client> displayOrder() {
        return Comparator.comparing(Client::getDisplayName, String.CASE_INSENSITIVE_ORDER)
                .thenComparing(Client::getId);
    }
}
