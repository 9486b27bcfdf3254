package com.delta.digest.tracker.model;

import com.delta.digest.tracker.util.CalendarDates;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;
import java.util.Optional;

public record Item(
    int schemaVersion,
    String id,
    String title,
    String sourceUrl,
    String author,
    String publishedDate,
    int sizeHint,
    String groupKey,
    String channel,
    int discoveryOrder,
    ItemStatus status,
    String content,
    String fetchError
) {
    public static final int SCHEMA_VERSION = 1;

    public static Item discovered(DiscoveredItem source, String groupKey, int discoveryOrder, ItemStatus status) {
        return new Item(
            SCHEMA_VERSION,
            source.id(),
            source.title(),
            source.url(),
            source.author(),
            source.publishedDate(),
            source.sizeHint(),
            groupKey,
            source.channel(),
            discoveryOrder,
            status,
            null,
            null
        );
    }

    public Item fetched(String fetchedContent) {
        return new Item(schemaVersion, id, title, sourceUrl, author, publishedDate, sizeHint, groupKey,
            channel, discoveryOrder, ItemStatus.FETCHED, fetchedContent, null);
    }

    public Item skipped(String reason) {
        return new Item(schemaVersion, id, title, sourceUrl, author, publishedDate, sizeHint, groupKey,
            channel, discoveryOrder, ItemStatus.SKIPPED, content, reason);
    }

    @JsonIgnore
    public Optional<LocalDate> publishedOn() {
        return CalendarDates.leadingDate(publishedDate);
    }
}
