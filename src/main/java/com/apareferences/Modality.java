package com.apareferences;

import java.util.EnumSet;
import java.util.Set;

/**
 * A predicate over {@link EntryType}: unconstrained, exact, or membership in a set.
 */
public record Modality(Kind kind, Set<EntryType> types) {

    public enum Kind {
        ANY,
        SPECIFIC,
        ALTERNATE
    }

    private static final Modality ANY = new Modality(Kind.ANY, Set.of());

    public Modality {
        types = types.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(types));
        if (kind == Kind.SPECIFIC && types.size() != 1) {
            throw new IllegalArgumentException("Specific modality needs exactly one type, got " + types);
        }
    }

    public static Modality any() {
        return ANY;
    }

    public static Modality specific(EntryType type) {
        return new Modality(Kind.SPECIFIC, Set.of(type));
    }

    public static Modality alternate(EntryType first, EntryType... rest) {
        return new Modality(Kind.ALTERNATE, EnumSet.of(first, rest));
    }

    public boolean matches(EntryType candidate) {
        return switch (kind) {
            case ANY -> true;
            case SPECIFIC, ALTERNATE -> types.contains(candidate);
        };
    }
}
