package com.apareferences;

/**
 * Renders {@link NumberRange}s with an optional label.
 */
public final class Ranges {

    public static final String EN_DASH = "–";

    private Ranges() {
    }

    /**
     * {@code "Vol. 3"} for a single value, {@code "Vols. 3–5"} otherwise. Empty labels render the
     * bare numbers with no leading space.
     */
    public static String format(String singularLabel, String pluralLabel, NumberRange range) {
        if (range.isSingle()) {
            return labelled(singularLabel, Long.toString(range.start()));
        }
        return labelled(pluralLabel, range.start() + EN_DASH + range.end());
    }

    public static String format(NumberRange range) {
        return format("", "", range);
    }

    public static String volumes(NumberRange range) {
        return format("Vol.", "Vols.", range);
    }

    private static String labelled(String label, String value) {
        if (label == null || label.isEmpty()) return value;
        return label + " " + value;
    }
}
