package com.flagship.invoice_ledger.readmodel;

import com.flagship.invoice_ledger.client.Client;
import lombok.Value;

/**
 * A client together with the number of its invoices (jobs).
 */
@Value
public class ClientSummary {

    Client client;
    int jobCount;

    public boolean hasJobs() {
        return jobCount > 0;
    }
}
