package com.apareferences;

import java.util.Optional;

/**
 * Renders publication dates and URL retrieval notes.
 */
public final class DateFormatter {

    private final CalendarNames calendar;
    private final ApaOptions options;

    public DateFormatter() {
        this(EnglishCalendarNames.INSTANCE, ApaOptions.DEFAULTS);
    }

    public DateFormatter(CalendarNames calendar, ApaOptions options) {
        this.calendar = calendar;
        this.options = options;
    }

    /**
     * {@code "(2020)"}, {@code "(2020, March)"}, {@code "(2020, March 5)"}, or {@code "(n. d.)"}
     * when the entry is undated.
     */
    public String renderDate(Entry entry) {
        Optional<EntryDate> date = entry.date();
        if (date.isEmpty()) {
            return "(" + options.noDateLabel() + ")";
        }
        EntryDate d = date.get();
        String year = year(d);
        if (d.month() == null) {
            return "(" + year + ")";
        }
        String month = month(d.month());
        if (d.day() == null) {
            return "(" + year + ", " + month + ")";
        }
        return "(" + year + ", " + month + " " + d.day() + ")";
    }

    /**
     * The URL with its visit date, or the bare URL when no visit date is known; empty without a URL.
     * Only the full-date form is parenthesised.
     */
    public Optional<String> renderRetrievalDate(Entry entry) {
        return entry.url().map(url -> {
            String value = url.value();
            if (url.visitDate() == null) {
                return value;
            }
            EntryDate d = url.visitDate();
            String year = year(d);
            if (d.month() == null) {
                return "Retrieved " + year + ", from " + value;
            }
            String month = month(d.month());
            if (d.day() == null) {
                return "Retrieved " + month + " " + year + ", from " + value;
            }
            return "(Retrieved " + month + " " + d.day() + ", " + year + ", from " + value + ")";
        });
    }

    private static String year(EntryDate d) {
        return d.year() < 0 ? String.format("-%04d", -d.year()) : String.format("%04d", d.year());
    }

    private String month(int month) {
        return calendar.monthName(month)
                .orElseThrow(() -> new IllegalStateException("No month name for " + month));
    }
}
