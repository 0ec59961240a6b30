package com.apareferences;

import java.util.Optional;

/**
 * Locale-specific names used in dates and editions.
 */
public interface CalendarNames {

    /**
     * Name of a one-based month, empty outside 1..12.
     */
    Optional<String> monthName(int month);

    /**
     * Ordinal word for {@code n}, e.g. "2nd".
     */
    String ordinal(long n);
}
