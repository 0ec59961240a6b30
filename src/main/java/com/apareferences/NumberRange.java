package com.apareferences;

/**
 * An inclusive numeric range; a single value has {@code start == end}.
 */
public record NumberRange(long start, long end) {

    public NumberRange {
        if (start > end) {
            throw new IllegalArgumentException("Range start " + start + " is after end " + end);
        }
    }

    public static NumberRange single(long value) {
        return new NumberRange(value, value);
    }

    public boolean isSingle() {
        return start == end;
    }
}
