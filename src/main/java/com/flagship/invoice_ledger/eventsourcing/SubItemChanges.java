package com.flagship.invoice_ledger.eventsourcing;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Difference between two versions of a sub-item list, keyed by item id.
 * Feeds the add/modify/delete sub-item operations of a repository.
 *
 * @param added    items only present in the current list
 * @param modified items present in both lists but no longer equal
 * @param deleted  ids only present in the previous list
 */
public record SubItemChanges<T extends SubItem>(List<T> added, List<T> modified, List<UUID> deleted) {

    public SubItemChanges {
        added = List.copyOf(added);
        modified = List.copyOf(modified);
        deleted = List.copyOf(deleted);
    }

    public static <T extends SubItem> SubItemChanges<T> between(List<T> previous, List<T> current) {
        Map<UUID, T> before = previous.stream()
                .collect(Collectors.toMap(SubItem::getId, Function.identity(), (first, second) -> second));
        List<T> added = new ArrayList<>();
        List<T> modified = new ArrayList<>();
        for (T item : current) {
            T old = before.remove(item.getId());
            if (old == null) {
                added.add(item);
            } else if (!old.equals(item)) {
                modified.add(item);
            }
        }
        List<UUID> deleted = previous.stream()
                .map(SubItem::getId)
                .filter(before::containsKey)
                .distinct()
                .toList();
        return new SubItemChanges<>(added, modified, deleted);
    }

    public boolean hasChanges() {
        return !added.isEmpty() || !modified.isEmpty() || !deleted.isEmpty();
    }
}
