package com.apareferences;

import java.util.Locale;
import java.util.Optional;

/**
 * English month names and ordinals, plus lenient month parsing for imported records.
 */
public final class EnglishCalendarNames implements CalendarNames {

    public static final EnglishCalendarNames INSTANCE = new EnglishCalendarNames();

    private static final String[] FULL = {
            "January", "February", "March", "April", "May", "June",
            "July", "August", "September", "October", "November", "December"
    };

    private EnglishCalendarNames() {
    }

    @Override
    public Optional<String> monthName(int month) {
        if (month < 1 || month > 12) return Optional.empty();
        return Optional.of(FULL[month - 1]);
    }

    @Override
    public String ordinal(long n) {
        long mod100 = Math.abs(n) % 100;
        String suffix;
        if (mod100 >= 11 && mod100 <= 13) {
            suffix = "th";
        } else {
            suffix = switch ((int) (Math.abs(n) % 10)) {
                case 1 -> "st";
                case 2 -> "nd";
                case 3 -> "rd";
                default -> "th";
            };
        }
        return n + suffix;
    }

    /**
     * Parses a month string to 1..12: numbers, full names, three-letter abbreviations with or
     * without a dot, BibTeX braces tolerated.
     */
    public static Integer parseMonthNumber(String monthRaw) {
        if (monthRaw == null) return null;
        String m = monthRaw.replace("{", "").replace("}", "").trim();
        if (m.isEmpty()) return null;

        if (m.chars().allMatch(Character::isDigit)) {
            try {
                int v = Integer.parseInt(m);
                return v >= 1 && v <= 12 ? v : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }

        String lower = m.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".")) lower = lower.substring(0, lower.length() - 1);
        if (lower.length() < 3) return null;
        for (int i = 0; i < 12; i++) {
            String full = FULL[i].toLowerCase(Locale.ROOT);
            if (full.startsWith(lower)) return i + 1;
        }
        return null;
    }
}
