package com.apareferences;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default sentence-case transform for English titles.
 *
 * <p>The first word and the first word after {@code :}, {@code ?}, {@code !} or {@code .} are
 * capitalised; other words are lower-cased unless they look like acronyms or proper nouns
 * (an upper-case letter after the first character, or a digit). Text in braces is kept as
 * written and the braces are dropped.
 */
public final class SentenceCase implements SentenceCaseTransformer {

    public static final SentenceCase DEFAULT = new SentenceCase();

    private static final Pattern TOKEN = Pattern.compile("\\{[^{}]*}|[^\\s{}]+|\\s+");

    private SentenceCase() {
    }

    @Override
    public String apply(String title) {
        if (title == null || title.isBlank()) return title;

        StringBuilder out = new StringBuilder();
        boolean capitalizeNext = true;
        Matcher m = TOKEN.matcher(title.trim());
        while (m.find()) {
            String token = m.group();
            if (token.isBlank()) {
                out.append(' ');
                continue;
            }
            if (token.startsWith("{")) {
                out.append(token, 1, token.length() - 1);
                capitalizeNext = false;
                continue;
            }
            out.append(capitalizeNext ? capitalize(token) : lowerUnlessProtected(token));
            char last = token.charAt(token.length() - 1);
            capitalizeNext = last == ':' || last == '?' || last == '!' || last == '.';
        }
        return out.toString();
    }

    private static String capitalize(String word) {
        int first = word.codePointAt(0);
        int len = Character.charCount(first);
        return new StringBuilder().appendCodePoint(Character.toUpperCase(first))
                .append(lowerUnlessProtected(word.substring(len), word))
                .toString();
    }

    private static String lowerUnlessProtected(String word) {
        return lowerUnlessProtected(word, word);
    }

    private static String lowerUnlessProtected(String part, String wholeWord) {
        return isProtected(wholeWord) ? part : part.toLowerCase(Locale.ROOT);
    }

    private static boolean isProtected(String word) {
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (Character.isDigit(c)) return true;
            if (i > 0 && Character.isUpperCase(c)) return true;
        }
        return false;
    }
}
