package com.apareferences;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A named contributor.
 *
 * <p>{@code prefix} holds lower-case particles such as "van de"; {@code givenName} is kept whole
 * and initials are derived from it on demand.
 */
public record Person(String name, String givenName, String prefix, String suffix) {

    public Person {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Person needs a family name");
        }
        name = name.trim();
        givenName = blankToNull(givenName);
        prefix = blankToNull(prefix);
        suffix = blankToNull(suffix);
    }

    public static Person of(String name, String givenName) {
        return new Person(name, givenName, null, null);
    }

    /**
     * Splits leading lower-case particles off the family part: {@code "van de Graf"} becomes prefix
     * {@code "van de"} and name {@code "Graf"}.
     */
    public static Person parse(String family, String givenName) {
        return parse(family, givenName, null);
    }

    public static Person parse(String family, String givenName, String suffix) {
        if (family == null || family.isBlank()) {
            throw new IllegalArgumentException("Person needs a family name");
        }
        String[] words = family.trim().split("\\s+");
        int firstUpper = 0;
        while (firstUpper < words.length - 1 && isParticle(words[firstUpper])) {
            firstUpper++;
        }
        String prefix = firstUpper == 0 ? null : String.join(" ", List.of(words).subList(0, firstUpper));
        String name = String.join(" ", List.of(words).subList(firstUpper, words.length));
        return new Person(name, givenName, prefix, suffix);
    }

    public Optional<String> prefixOpt() {
        return Optional.ofNullable(prefix);
    }

    public Optional<String> suffixOpt() {
        return Optional.ofNullable(suffix);
    }

    /**
     * Initials of the given name, one per space-delimited token, each followed by {@code delimiter}.
     * Hyphenated tokens keep the hyphen: "Hans-Joseph" gives "H.-J.".
     */
    public Optional<String> initials(String delimiter) {
        if (givenName == null) {
            return Optional.empty();
        }
        String delim = delimiter == null ? "" : delimiter;
        List<String> tokens = new ArrayList<>();
        for (String word : givenName.split("\\s+")) {
            if (word.isEmpty()) continue;
            List<String> parts = new ArrayList<>();
            for (String part : word.split("-")) {
                if (part.isEmpty()) continue;
                parts.add(new String(Character.toChars(part.codePointAt(0))) + delim);
            }
            if (!parts.isEmpty()) {
                tokens.add(String.join("-", parts));
            }
        }
        return tokens.isEmpty() ? Optional.empty() : Optional.of(String.join(" ", tokens));
    }

    private static boolean isParticle(String word) {
        int first = word.codePointAt(0);
        return Character.isLetter(first) && Character.isLowerCase(first);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
