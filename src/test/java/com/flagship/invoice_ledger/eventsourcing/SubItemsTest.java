package com.flagship.invoice_ledger.eventsourcing;

import com.flagship.invoice_ledger.invoice.InvoiceItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static com.flagship.invoice_ledger.support.Fixtures.fixedItem;
import static com.flagship.invoice_ledger.support.Fixtures.hourlyItem;
import static org.junit.jupiter.api.Assertions.*;

class SubItemsTest {

    private final InvoiceItem painting = hourlyItem("Painting", "8", "45.00");
    private final InvoiceItem material = fixedItem("Material", "120.00");

    @Test
    @DisplayName("add skips items whose id is already present")
    void addIsIdempotentById() {
        List<InvoiceItem> once = SubItems.add(List.of(), List.of(painting));
        List<InvoiceItem> twice = SubItems.add(once, List.of(painting, material));

        assertEquals(List.of(painting, material), twice);
        assertEquals(twice, SubItems.add(twice, List.of(material)));
    }

    @Test
    @DisplayName("modify replaces in place and appends unknown ids")
    void modifyUpserts() {
        InvoiceItem repainted = painting.toBuilder().description("Painting, two coats").build();
        InvoiceItem extra = fixedItem("Disposal", "30.00");

        List<InvoiceItem> result = SubItems.modify(List.of(painting, material), List.of(repainted, extra));

        assertEquals(List.of(repainted, material, extra), result);
    }

    @Test
    @DisplayName("delete ignores ids that are not present")
    void deleteIgnoresMissingIds() {
        List<InvoiceItem> result = SubItems.delete(List.of(painting, material), List.of(material.getId(), UUID.randomUUID()));

        assertEquals(List.of(painting), result);
    }

    @Test
    @DisplayName("results are unmodifiable and inputs untouched")
    void resultsAreUnmodifiable() {
        List<InvoiceItem> current = List.of(painting);
        List<InvoiceItem> result = SubItems.add(current, List.of(material));

        assertEquals(1, current.size());
        assertThrows(UnsupportedOperationException.class, () -> result.add(painting));
    }
}
