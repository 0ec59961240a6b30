package com.apareferences;

/**
 * An edition: either a number rendered as an ordinal, or a free-text label kept as written.
 */
public record Edition(Long number, String label) {

    public Edition {
        if ((number == null) == (label == null)) {
            throw new IllegalArgumentException("Edition is either a number or a label");
        }
    }

    public static Edition of(long number) {
        return new Edition(number, null);
    }

    public static Edition of(String label) {
        return new Edition(null, label);
    }

    public boolean isNumber() {
        return number != null;
    }
}
