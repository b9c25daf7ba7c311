package com.flagship.invoice_ledger.client;

import com.flagship.invoice_ledger.client.event.ClientCreated;
import com.flagship.invoice_ledger.client.event.ClientEvent;
import com.flagship.invoice_ledger.client.event.ClientEventKind;
import com.flagship.invoice_ledger.client.event.ClientUpdated;
import com.flagship.invoice_ledger.eventsourcing.AggregateProjection;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class ClientProjection extends AggregateProjection<Client, ClientEvent> {

    public static final String AGGREGATE_TYPE = "Client";

    public ClientProjection() {
        super(AGGREGATE_TYPE, Client.class, ClientEvent.class, ClientEventKind.class);
    }

    @Override
    public Client initialState(UUID id) {
        return Client.builder().id(id).build();
    }

    @Override
    protected Client apply(Client state, ClientEvent event) {
        return switch (event.kind()) {
            case CLIENT_CREATED -> applyCreated(state, (ClientCreated) event);
            case CLIENT_UPDATED -> applyUpdated(state, (ClientUpdated) event);
            // Deletion only hides the client
            case CLIENT_DELETED -> state;
        };
    }

    private static Client applyCreated(Client state, ClientCreated event) {
        return state.toBuilder()
                .firstName(event.firstName())
                .lastName(event.lastName())
                .companyName(event.companyName())
                .company(event.company())
                .gender(event.gender())
                .email(event.email())
                .phoneNumber(event.phoneNumber())
                .address(orEmpty(event.address()))
                .build();
    }

    private static Client applyUpdated(Client state, ClientUpdated event) {
        return state.toBuilder()
                .firstName(event.firstName())
                .lastName(event.lastName())
                .companyName(event.companyName())
                .company(event.company())
                .gender(event.gender())
                .email(event.email())
                .phoneNumber(event.phoneNumber())
                .address(orEmpty(event.address()))
                .build();
    }

    private static Address orEmpty(Address address) {
        return address != null ? address : Address.empty();
    }
}
