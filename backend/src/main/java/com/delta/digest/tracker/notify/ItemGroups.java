package com.delta.digest.tracker.notify;

import com.delta.digest.tracker.model.Item;
import com.delta.digest.tracker.model.ItemGroup;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ItemGroups {
    private ItemGroups() {
    }

    public static List<ItemGroup> group(List<Item> items) {
        Map<String, List<Item>> byKey = new LinkedHashMap<>();
        for (Item item : items) {
            String key = item.groupKey() == null ? "" : item.groupKey();
            byKey.computeIfAbsent(key, ignored -> new ArrayList<>()).add(item);
        }
        List<ItemGroup> groups = new ArrayList<>(byKey.size());
        for (Map.Entry<String, List<Item>> entry : byKey.entrySet()) {
            List<Item> sorted = new ArrayList<>(entry.getValue());
            sorted.sort(Comparator.comparingInt(Item::discoveryOrder));
            groups.add(new ItemGroup(entry.getKey(), List.copyOf(sorted)));
        }
        return groups;
    }

    public static int totalItems(List<ItemGroup> groups) {
        int total = 0;
        for (ItemGroup group : groups) {
            total += group.items().size();
        }
        return total;
    }
}
