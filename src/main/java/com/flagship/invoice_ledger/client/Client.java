package com.flagship.invoice_ledger.client;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.invoice_ledger.eventsourcing.AggregateRoot;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A customer, either an individual or a company.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class Client implements AggregateRoot<Client> {

    UUID id;
    long version;
    Instant createdOn;
    Instant modifiedOn;

    String firstName;
    String lastName;
    String companyName;
    boolean company;
    Gender gender;
    String email;
    String phoneNumber;
    @Builder.Default
    Address address = Address.empty();

    /**
     * First and last name separated by a space; missing parts are left out.
     */
    @JsonIgnore
    public String getFullName() {
        return Stream.of(firstName, lastName)
                .filter(part -> part != null && !part.isBlank())
                .collect(Collectors.joining(" "));
    }

    /**
     * Name shown in lists: the company name for companies, the full name otherwise.
     */
    @JsonIgnore
    public String getDisplayName() {
        if (company && companyName != null && !companyName.isBlank()) {
            return companyName;
        }
        return getFullName();
    }

    /**
     * Every violated invariant, in a fixed order. Empty when the client is valid.
     */
    public List<String> validationErrors() {
        List<String> errors = new ArrayList<>();
        if (isBlank(phoneNumber)) {
            errors.add("Phone number is required.");
        }
        if (company) {
            if (isBlank(companyName)) {
                errors.add("Company name is required for company clients.");
            }
        } else {
            if (isBlank(firstName)) {
                errors.add("First name is required for individual clients.");
            }
            if (isBlank(lastName)) {
                errors.add("Last name is required for individual clients.");
            }
        }
        return errors;
    }

    @JsonIgnore
    public boolean isValid() {
        return validationErrors().isEmpty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
