package com.delta.digest.tracker.util;

import com.delta.digest.tracker.model.DiscoveredItem;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public final class ItemFilters {
    private ItemFilters() {
    }

    public static List<DiscoveredItem> dedupe(List<DiscoveredItem> items) {
        Set<String> seen = new HashSet<>();
        List<DiscoveredItem> out = new ArrayList<>();
        for (DiscoveredItem item : items) {
            if (item.id() != null && seen.add(item.id())) {
                out.add(item);
            }
        }
        return out;
    }

    public static List<DiscoveredItem> publishedWithin(List<DiscoveredItem> items, LocalDate today, int maxAgeDays) {
        LocalDate cutoff = today.minusDays(Math.max(0, maxAgeDays));
        List<DiscoveredItem> out = new ArrayList<>();
        for (DiscoveredItem item : items) {
            Optional<LocalDate> published = item.publishedOn();
            if (published.isPresent() && !published.get().isBefore(cutoff)) {
                out.add(item);
            }
        }
        return out;
    }

    public static ZoneId zoneOrUtc(String zone) {
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            return ZoneId.of("UTC");
        }
    }
}
