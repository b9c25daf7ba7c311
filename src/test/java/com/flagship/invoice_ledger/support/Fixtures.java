package com.flagship.invoice_ledger.support;

import com.flagship.invoice_ledger.client.Address;
import com.flagship.invoice_ledger.client.Client;
import com.flagship.invoice_ledger.client.Country;
import com.flagship.invoice_ledger.client.Gender;
import com.flagship.invoice_ledger.invoice.BillingType;
import com.flagship.invoice_ledger.invoice.ExpenseProofFile;
import com.flagship.invoice_ledger.invoice.Invoice;
import com.flagship.invoice_ledger.invoice.InvoiceItem;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public final class Fixtures {

    private Fixtures() {
    }

    public static Client individual(String firstName, String lastName) {
        return Client.builder()
                .firstName(firstName)
                .lastName(lastName)
                .gender(Gender.MALE)
                .email(firstName.toLowerCase() + "@example.com")
                .phoneNumber("+49 7303 123456")
                .address(Address.builder()
                        .street("Hauptstrasse 19")
                        .postalCode("89257")
                        .city("Illertissen")
                        .country(Country.GERMANY)
                        .build())
                .build();
    }

    public static Client company(String companyName) {
        return Client.builder()
                .company(true)
                .companyName(companyName)
                .email("office@" + companyName.toLowerCase().replace(' ', '-') + ".example")
                .phoneNumber("+43 1 555 0100")
                .address(Address.builder()
                        .street("Ringstrasse 1")
                        .postalCode("1010")
                        .city("Wien")
                        .country(Country.AUSTRIA)
                        .build())
                .build();
    }

    public static InvoiceItem hourlyItem(String description, String hours, String rate) {
        return InvoiceItem.builder()
                .description(description)
                .billingType(BillingType.PER_HOUR)
                .quantity(new BigDecimal(hours))
                .unitPrice(new BigDecimal(rate))
                .build();
    }

    public static InvoiceItem fixedItem(String description, String amount) {
        return InvoiceItem.builder()
                .description(description)
                .billingType(BillingType.FIXED_PRICE)
                .fixedAmount(new BigDecimal(amount))
                .build();
    }

    public static ExpenseProofFile receipt(String fileName, String amount) {
        return ExpenseProofFile.builder()
                .fileName(fileName)
                .contentType("application/pdf")
                .fileContent(new byte[]{1, 2, 3})
                .fileSize(3)
                .description("Material")
                .amount(new BigDecimal(amount))
                .build();
    }

    public static Invoice invoice(String number, UUID clientId, LocalDate invoiceDate, InvoiceItem... items) {
        return Invoice.draft(clientId, invoiceDate).toBuilder()
                .invoiceNumber(number)
                .items(List.of(items))
                .build();
    }
}
