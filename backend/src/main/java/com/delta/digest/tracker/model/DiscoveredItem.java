package com.delta.digest.tracker.model;

import com.delta.digest.tracker.util.CalendarDates;

import java.time.LocalDate;
import java.util.Optional;

public record DiscoveredItem(
    String id,
    String title,
    String url,
    String author,
    String publishedDate,
    int sizeHint,
    String channel
) {
    public Optional<LocalDate> publishedOn() {
        return CalendarDates.leadingDate(publishedDate);
    }
}
