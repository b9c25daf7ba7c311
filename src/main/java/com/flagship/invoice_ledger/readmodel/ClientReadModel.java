package com.flagship.invoice_ledger.readmodel;

import com.flagship.invoice_ledger.client.Client;
import com.flagship.invoice_ledger.client.ClientRepository;
import com.flagship.invoice_ledger.client.Country;
import com.flagship.invoice_ledger.invoice.Invoice;
import com.flagship.invoice_ledger.invoice.InvoiceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/**
 * Client lists for browsing and filtering, computed from the materialized
 * clients and invoices on every call. Nothing here is stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClientReadModel {

    private final ClientRepository clientRepository;
    private final InvoiceRepository invoiceRepository;

    /**
     * Every live client with its invoice count, ordered by display name.
     */
    public CompletableFuture<List<ClientSummary>> getAllClientsWithJobCounts() {
        return withClientsAndInvoices((clients, invoices) -> summarize(clients, countByClient(invoices)));
    }

    /**
     * Number of live invoices per client id. Clients without invoices are absent.
     */
    public CompletableFuture<Map<UUID, Long>> invoiceCountsByClient() {
        return invoiceRepository.getAll().thenApply(ClientReadModel::countByClient);
    }

    /**
     * Distinct countries of client addresses, in enum order.
     */
    public CompletableFuture<List<Country>> countries() {
        return clientRepository.getAll().thenApply(clients -> clients.stream()
                .map(client -> client.getAddress() != null ? client.getAddress().getCountry() : null)
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList());
    }

    /**
     * Distinct years of invoice dates, ascending.
     */
    public CompletableFuture<List<Integer>> invoiceYears() {
        return invoiceRepository.getAll().thenApply(invoices -> invoices.stream()
                .map(Invoice::getInvoiceDate)
                .filter(Objects::nonNull)
                .map(LocalDate::getYear)
                .distinct()
                .sorted()
                .toList());
    }

    /**
     * Distinct years (UTC) in which clients were created, ascending.
     */
    public CompletableFuture<List<Integer>> clientCreationYears() {
        return clientRepository.getAll().thenApply(clients -> clients.stream()
                .map(ClientReadModel::createdDate)
                .filter(Objects::nonNull)
                .map(LocalDate::getYear)
                .distinct()
                .sorted()
                .toList());
    }

    /**
     * Clients matching every set criterion of the filter, with their invoice
     * counts, ordered by display name.
     */
    public CompletableFuture<List<ClientSummary>> filter(ClientFilter filter) {
        ClientFilter criteria = filter != null ? filter : ClientFilter.none();
        return withClientsAndInvoices((clients, invoices) -> {
            Map<UUID, List<Invoice>> invoicesByClient = invoices.stream()
                    .filter(invoice -> invoice.getClientId() != null)
                    .collect(Collectors.groupingBy(Invoice::getClientId));
            List<ClientSummary> result = summarize(clients, countByClient(invoices)).stream()
                    .filter(summary -> matches(criteria, summary,
                            invoicesByClient.getOrDefault(summary.getClient().getId(), List.of())))
                    .toList();
            log.debug("Client filter matched {} of {} client(s)", result.size(), clients.size());
            return result;
        });
    }

    static boolean matches(ClientFilter filter, ClientSummary summary, List<Invoice> invoices) {
        Client client = summary.getClient();

        if (isSet(filter.getSearchQuery())
                && !ClientRepository.matches(client, filter.getSearchQuery().trim().toLowerCase(Locale.ROOT))) {
            return false;
        }
        if (filter.getClientType() != null
                && client.isCompany() != (filter.getClientType() == ClientType.COMPANY)) {
            return false;
        }
        if (filter.getGender() != null && (client.isCompany() || client.getGender() != filter.getGender())) {
            return false;
        }
        if (filter.getCountry() != null
                && (client.getAddress() == null || client.getAddress().getCountry() != filter.getCountry())) {
            return false;
        }
        if (!matchesCreation(filter, createdDate(client))) {
            return false;
        }
        if (filter.getInvoiceYear() != null && invoices.stream()
                .map(Invoice::getInvoiceDate)
                .noneMatch(date -> date != null && date.getYear() == filter.getInvoiceYear())) {
            return false;
        }
        if ((filter.getInvoicesFrom() != null || filter.getInvoicesTo() != null) && invoices.stream()
                .map(Invoice::getInvoiceDate)
                .noneMatch(date -> within(date, filter.getInvoicesFrom(), filter.getInvoicesTo()))) {
            return false;
        }
        if (!matchesJobCount(filter, summary.getJobCount())) {
            return false;
        }
        if (isSet(filter.getCity()) && !containsIgnoreCase(
                client.getAddress() != null ? client.getAddress().getCity() : null, filter.getCity().trim())) {
            return false;
        }
        if (isSet(filter.getPostalCode())) {
            String postalCode = client.getAddress() != null ? client.getAddress().getPostalCode() : null;
            return postalCode != null && postalCode.startsWith(filter.getPostalCode().trim());
        }
        return true;
    }

    private static boolean matchesCreation(ClientFilter filter, LocalDate created) {
        if (filter.getCreationYear() == null && filter.getCreatedFrom() == null && filter.getCreatedTo() == null) {
            return true;
        }
        if (created == null) {
            return false;
        }
        if (filter.getCreationYear() != null && created.getYear() != filter.getCreationYear()) {
            return false;
        }
        return within(created, filter.getCreatedFrom(), filter.getCreatedTo());
    }

    private static boolean matchesJobCount(ClientFilter filter, int jobCount) {
        if (filter.getMinJobCount() != null && jobCount < filter.getMinJobCount()) {
            return false;
        }
        if (filter.getMaxJobCount() != null && jobCount > filter.getMaxJobCount()) {
            return false;
        }
        return filter.getHasJobs() == null || filter.getHasJobs() == (jobCount > 0);
    }

    private static boolean within(LocalDate date, LocalDate from, LocalDate to) {
        if (date == null) {
            return false;
        }
        return (from == null || !date.isBefore(from)) && (to == null || !date.isAfter(to));
    }

    private <T> CompletableFuture<T> withClientsAndInvoices(BiFunction<List<Client>, List<Invoice>, T> combiner) {
        return clientRepository.getAll().thenCombine(invoiceRepository.getAll(), combiner);
    }

    private static List<ClientSummary> summarize(List<Client> clients, Map<UUID, Long> counts) {
        return clients.stream()
                .map(client -> new ClientSummary(client, counts.getOrDefault(client.getId(), 0L).intValue()))
                .toList();
    }

    private static Map<UUID, Long> countByClient(List<Invoice> invoices) {
        return Collections.unmodifiableMap(invoices.stream()
                .filter(invoice -> invoice.getClientId() != null)
                .collect(Collectors.groupingBy(Invoice::getClientId, Collectors.counting())));
    }

    private static LocalDate createdDate(Client client) {
        return client.getCreatedOn() != null ? LocalDate.ofInstant(client.getCreatedOn(), ZoneOffset.UTC) : null;
    }

    private static boolean containsIgnoreCase(String value, String text) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(text.toLowerCase(Locale.ROOT));
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
