package com.apareferences;

import java.util.Optional;

/**
 * The shape an entry's venue clause takes, plus the index of the parent that supplied it.
 *
 * <p>Computed per formatting call and never stored; the parent index refers into the parent list
 * of the entry it was computed for.
 */
public record SourceType(Shape shape, Integer parentIndex) {

    public enum Shape {
        PERIODICAL_ITEM(true),
        COLLECTION_ITEM(true),
        TV_SERIES(true),
        THESIS(false),
        MANUSCRIPT(false),
        ART_CONTAINER(true),
        STANDALONE_ART(false),
        STANDALONE_WEB_ITEM(false),
        WEB_ITEM(true),
        NEWS_ITEM(true),
        CONFERENCE_TALK(true),
        GENERIC(false);

        private final boolean withParent;

        Shape(boolean withParent) {
            this.withParent = withParent;
        }

        public boolean withParent() {
            return withParent;
        }
    }

    public SourceType {
        if (shape.withParent() != (parentIndex != null)) {
            throw new IllegalArgumentException(shape + (shape.withParent()
                    ? " needs a parent index" : " takes no parent index"));
        }
    }

    public static SourceType of(Shape shape) {
        return new SourceType(shape, null);
    }

    /**
     * A parent-carrying shape for {@code entry}.
     *
     * @throws IllegalStateException if {@code parentIndex} is not a valid index into the entry's parents
     */
    public static SourceType of(Shape shape, Entry entry, int parentIndex) {
        checkIndex(entry, parentIndex);
        return new SourceType(shape, parentIndex);
    }

    /**
     * The parent this shape was matched against.
     *
     * @throws IllegalStateException if the carried index does not fit {@code entry}'s parent list
     */
    public Optional<Entry> parent(Entry entry) {
        if (parentIndex == null) return Optional.empty();
        checkIndex(entry, parentIndex);
        return Optional.of(entry.parents().get(parentIndex));
    }

    private static void checkIndex(Entry entry, int index) {
        if (index < 0 || index >= entry.parents().size()) {
            throw new IllegalStateException("Parent index " + index + " out of bounds for " + entry
                    + " with " + entry.parents().size() + " parent(s)");
        }
    }
}
