package com.flagship.invoice_ledger.invoice;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.invoice_ledger.eventsourcing.SubItem;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One billed line of an invoice. Which amounts matter depends on the billing type.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class InvoiceItem implements SubItem {

    @Builder.Default
    UUID id = UUID.randomUUID();
    String description;
    BillingType billingType;

    // PER_HOUR and PER_OBJECT
    @Builder.Default
    BigDecimal quantity = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal unitPrice = BigDecimal.ZERO;

    // PER_SQUARE_METER
    @Builder.Default
    BigDecimal area = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal pricePerSquareMeter = BigDecimal.ZERO;

    // FIXED_PRICE
    @Builder.Default
    BigDecimal fixedAmount = BigDecimal.ZERO;

    @JsonIgnore
    public BigDecimal getTotal() {
        if (billingType == null) {
            return BigDecimal.ZERO;
        }
        return switch (billingType) {
            case PER_HOUR, PER_OBJECT -> orZero(quantity).multiply(orZero(unitPrice));
            case PER_SQUARE_METER -> orZero(area).multiply(orZero(pricePerSquareMeter));
            case FIXED_PRICE -> orZero(fixedAmount);
        };
    }

    /**
     * Violations of this item, each prefixed with its 1-based position.
     */
    public List<String> validationErrors(int itemNumber) {
        List<String> errors = new ArrayList<>();
        String prefix = "Item " + itemNumber + ": ";
        if (description == null || description.isBlank()) {
            errors.add(prefix + "Description is required.");
        }
        if (billingType == null) {
            errors.add(prefix + "Billing type is required.");
            return errors;
        }
        switch (billingType) {
            case PER_HOUR, PER_OBJECT -> {
                if (!isPositive(quantity)) {
                    errors.add(prefix + "Quantity must be greater than 0.");
                }
                if (!isPositive(unitPrice)) {
                    errors.add(prefix + "Unit price must be greater than 0.");
                }
            }
            case PER_SQUARE_METER -> {
                if (!isPositive(area)) {
                    errors.add(prefix + "Area must be greater than 0.");
                }
                if (!isPositive(pricePerSquareMeter)) {
                    errors.add(prefix + "Price per square meter must be greater than 0.");
                }
            }
            case FIXED_PRICE -> {
                if (!isPositive(fixedAmount)) {
                    errors.add(prefix + "Fixed amount must be greater than 0.");
                }
            }
        }
        return errors;
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
