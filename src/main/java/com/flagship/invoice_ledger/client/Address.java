package com.flagship.invoice_ledger.client;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Postal address. Country defaults to Germany.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Address {

    String companyOrPerson;
    String street;
    String postalCode;
    String city;
    @Builder.Default
    Country country = Country.GERMANY;

    public static Address empty() {
        return Address.builder().build();
    }

    /**
     * Multi-line form as printed on invoices; blank lines are left out.
     */
    public String toMultilineString() {
        String cityLine = Stream.of(postalCode, city)
                .filter(part -> part != null && !part.isBlank())
                .collect(Collectors.joining(" "));
        return Stream.of(companyOrPerson, street, cityLine)
                .filter(line -> line != null && !line.isBlank())
                .collect(Collectors.joining("\n"));
    }
}
