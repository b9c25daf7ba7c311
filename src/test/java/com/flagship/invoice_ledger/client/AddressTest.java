package com.flagship.invoice_ledger.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AddressTest {

    @Test
    @DisplayName("an empty address defaults to Germany and prints nothing")
    void empty() {
        Address address = Address.empty();

        assertEquals(Country.GERMANY, address.getCountry());
        assertEquals("", address.toMultilineString());
    }

    @Test
    @DisplayName("the printed form skips blank lines")
    void multiline() {
        Address address = Address.builder()
                .companyOrPerson("Acme Bau GmbH")
                .street(" ")
                .postalCode("89257")
                .city("Illertissen")
                .build();

        assertEquals("Acme Bau GmbH\n89257 Illertissen", address.toMultilineString());
    }
}
