package com.flagship.invoice_ledger.readmodel;

import com.flagship.invoice_ledger.client.Country;
import com.flagship.invoice_ledger.client.Gender;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Criteria for {@link ClientReadModel#filter(ClientFilter)}. Unset criteria match
 * every client; set criteria must all match.
 */
@Value
@Builder(toBuilder = true)
public class ClientFilter {

    /** contained in first, last or company name or email, ignoring case */
    String searchQuery;
    ClientType clientType;
    /** applies to individuals only; companies never match a gender */
    Gender gender;
    Country country;
    Integer creationYear;
    LocalDate createdFrom;
    LocalDate createdTo;
    /** the client has an invoice dated in this year */
    Integer invoiceYear;
    /** the client has an invoice dated on or after this day (and on or before invoicesTo) */
    LocalDate invoicesFrom;
    LocalDate invoicesTo;
    Integer minJobCount;
    Integer maxJobCount;
    Boolean hasJobs;
    /** contained in the city, ignoring case */
    String city;
    /** prefix of the postal code */
    String postalCode;

    public static ClientFilter none() {
        return ClientFilter.builder().build();
    }

    public boolean hasActiveFilters() {
        return isSet(searchQuery)
                || clientType != null
                || gender != null
                || country != null
                || creationYear != null
                || createdFrom != null
                || createdTo != null
                || invoiceYear != null
                || invoicesFrom != null
                || invoicesTo != null
                || minJobCount != null
                || maxJobCount != null
                || hasJobs != null
                || isSet(city)
                || isSet(postalCode);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
