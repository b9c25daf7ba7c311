package com.flagship.invoice_ledger.eventsourcing;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Fold helpers for collection-valued aggregate fields.
 *
 * All three operations are pure: they return a new unmodifiable list and never
 * touch the input. Order of existing items is preserved.
 */
public final class SubItems {

    private SubItems() {
        // Utility class
    }

    /**
     * Appends the given items, skipping any whose id is already present.
     */
    public static <T extends SubItem> List<T> add(List<T> current, Collection<? extends T> added) {
        List<T> result = new ArrayList<>(current);
        Set<UUID> ids = new HashSet<>();
        for (T item : current) {
            ids.add(item.getId());
        }
        for (T item : added) {
            if (ids.add(item.getId())) {
                result.add(item);
            }
        }
        return List.copyOf(result);
    }

    /**
     * Replaces items in place by id; items not yet present are appended.
     */
    public static <T extends SubItem> List<T> modify(List<T> current, Collection<? extends T> modified) {
        Map<UUID, T> byId = new LinkedHashMap<>();
        for (T item : current) {
            byId.put(item.getId(), item);
        }
        for (T item : modified) {
            byId.put(item.getId(), item);
        }
        return List.copyOf(byId.values());
    }

    /**
     * Removes items with the given ids. Unknown ids are ignored.
     */
    public static <T extends SubItem> List<T> delete(List<T> current, Collection<UUID> ids) {
        Set<UUID> removed = new HashSet<>(ids);
        return current.stream()
                .filter(item -> !removed.contains(item.getId()))
                .toList();
    }
}
