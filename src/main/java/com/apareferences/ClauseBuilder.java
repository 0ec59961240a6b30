package com.apareferences;

/**
 * Joins optional clauses with a separator that is only written between emitted clauses, and
 * closes the result with a period only when something was emitted.
 *
 * <pre>
 * new ClauseBuilder().add("Nature").add(null).add("12(3)").terminate()  // "Nature, 12(3)."
 * new ClauseBuilder().add(null).terminate()                             // ""
 * </pre>
 */
public final class ClauseBuilder {

    private final String separator;
    private final StringBuilder sb = new StringBuilder();
    private boolean emitted;

    public ClauseBuilder() {
        this(", ");
    }

    public ClauseBuilder(String separator) {
        this.separator = separator;
    }

    /**
     * Appends {@code clause} unless it is null or blank.
     */
    public ClauseBuilder add(String clause) {
        if (clause == null || clause.isBlank()) return this;
        if (emitted) sb.append(separator);
        sb.append(clause);
        emitted = true;
        return this;
    }

    public boolean isEmpty() {
        return !emitted;
    }

    @Override
    public String toString() {
        return sb.toString();
    }

    /**
     * The joined clauses followed by a period, or the empty string when nothing was added.
     * No period is added when the last clause already ends in terminal punctuation.
     */
    public String terminate() {
        return emitted ? withPeriod(sb.toString()) : "";
    }

    /**
     * Appends a period unless {@code text} already ends in {@code ?}, {@code .} or {@code !}.
     */
    public static String withPeriod(String text) {
        if (text.isEmpty()) return text;
        char last = text.charAt(text.length() - 1);
        if (last == '?' || last == '.' || last == '!') return text;
        return text + ".";
    }
}
