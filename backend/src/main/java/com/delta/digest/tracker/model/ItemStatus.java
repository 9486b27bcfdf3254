package com.delta.digest.tracker.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ItemStatus {
    PENDING,
    FETCHED,
    SKIPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ItemStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return ItemStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
