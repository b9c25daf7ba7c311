package com.flagship.invoice_ledger.client.event;

import com.flagship.invoice_ledger.client.Address;
import com.flagship.invoice_ledger.client.Client;
import com.flagship.invoice_ledger.client.Gender;

/**
 * A client was created. Carries every field of the client.
 */
public record ClientCreated(
        String firstName,
        String lastName,
        String companyName,
        boolean company,
        Gender gender,
        String email,
        String phoneNumber,
        Address address
) implements ClientEvent {

    public static ClientCreated of(Client client) {
        return new ClientCreated(
                client.getFirstName(),
                client.getLastName(),
                client.getCompanyName(),
                client.isCompany(),
                client.getGender(),
                client.getEmail(),
                client.getPhoneNumber(),
                client.getAddress());
    }

    @Override
    public ClientEventKind kind() {
        return ClientEventKind.CLIENT_CREATED;
    }
}
