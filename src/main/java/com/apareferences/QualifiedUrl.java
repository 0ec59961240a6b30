package com.apareferences;

import java.util.Optional;

/**
 * A URL with the date it was last visited, if known.
 */
public record QualifiedUrl(String value, EntryDate visitDate) {

    public QualifiedUrl {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("URL must not be blank");
        }
    }

    public static QualifiedUrl of(String value) {
        return new QualifiedUrl(value, null);
    }

    public Optional<EntryDate> visitDateOpt() {
        return Optional.ofNullable(visitDate);
    }
}
