package com.apareferences;

import java.util.Optional;

/**
 * A calendar date of variable precision: year, year and month, or full date.
 * Months and days are one-based.
 */
public record EntryDate(int year, Integer month, Integer day) {

    public EntryDate {
        if (day != null && month == null) {
            throw new IllegalArgumentException("A day requires a month");
        }
        if (month != null && (month < 1 || month > 12)) {
            throw new IllegalArgumentException("Month out of range: " + month);
        }
        if (day != null && (day < 1 || day > 31)) {
            throw new IllegalArgumentException("Day out of range: " + day);
        }
    }

    public static EntryDate ofYear(int year) {
        return new EntryDate(year, null, null);
    }

    public static EntryDate ofMonth(int year, int month) {
        return new EntryDate(year, month, null);
    }

    public static EntryDate of(int year, int month, int day) {
        return new EntryDate(year, month, day);
    }

    /**
     * Parses {@code YYYY}, {@code YYYY-MM} or {@code YYYY-MM-DD}.
     *
     * @return empty when the text is not one of those shapes
     */
    public static Optional<EntryDate> parseIso(String text) {
        if (text == null) return Optional.empty();
        String[] parts = text.trim().split("-");
        if (parts.length == 0 || parts.length > 3) return Optional.empty();
        try {
            int year = Integer.parseInt(parts[0]);
            Integer month = parts.length > 1 ? Integer.valueOf(parts[1]) : null;
            Integer day = parts.length > 2 ? Integer.valueOf(parts[2]) : null;
            return Optional.of(new EntryDate(year, month, day));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public Optional<Integer> monthOpt() {
        return Optional.ofNullable(month);
    }

    public Optional<Integer> dayOpt() {
        return Optional.ofNullable(day);
    }
}
