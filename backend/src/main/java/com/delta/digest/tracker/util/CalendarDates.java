package com.delta.digest.tracker.util;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

public final class CalendarDates {
    private static final int ISO_DATE_LENGTH = 10;

    private CalendarDates() {
    }

    public static Optional<LocalDate> leadingDate(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (trimmed.length() < ISO_DATE_LENGTH) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(trimmed.substring(0, ISO_DATE_LENGTH)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
