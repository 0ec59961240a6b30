package com.apareferences;

import java.util.OptionalInt;

/**
 * A type pattern over an entry and, optionally, one of its parents.
 *
 * <p>With a {@code null} parent modality only the entry's own type is tested; the entry may still
 * have parents.
 */
public record EntryTypeSpec(Modality own, Modality parent) {

    public static EntryTypeSpec single(EntryType type) {
        return new EntryTypeSpec(Modality.specific(type), null);
    }

    public static EntryTypeSpec of(Modality own) {
        return new EntryTypeSpec(own, null);
    }

    public static EntryTypeSpec withParent(Modality own, Modality parent) {
        return new EntryTypeSpec(own, parent);
    }

    public boolean requiresParent() {
        return parent != null;
    }

    /**
     * Whether the entry satisfies the pattern.
     */
    public boolean matches(Entry entry) {
        if (!own.matches(entry.type())) return false;
        return parent == null || entry.findParent(parent).isPresent();
    }

    /**
     * Index of the first parent satisfying the parent modality, if the entry's own type matches.
     * Always empty for patterns without a parent modality.
     */
    public OptionalInt matchingParent(Entry entry) {
        if (parent == null || !own.matches(entry.type())) {
            return OptionalInt.empty();
        }
        return entry.findParent(parent);
    }
}
