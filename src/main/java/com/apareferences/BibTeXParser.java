package com.apareferences;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Brace- and quote-aware scanner for BibTeX sources.
 *
 * <p>Splits input into raw {@code @type{key, ...}} blocks and reads their fields. It tolerates:
 * <ul>
 *   <li>braces or parentheses as entry delimiters</li>
 *   <li>nested braces and quoted values with escaped quotes</li>
 *   <li>bare values such as {@code year = 2020}</li>
 * </ul>
 * {@code @comment}, {@code @preamble} and {@code @string} blocks are skipped. Problems are
 * collected in {@link ParseResult#errors()} rather than thrown.
 */
public final class BibTeXParser {

    private BibTeXParser() {
    }

    public record RawEntry(String type, String key, String raw) {}

    public record ParseResult(List<RawEntry> entries, List<String> errors) {}

    public static ParseResult parseEntries(String input) {
        List<RawEntry> entries = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        if (input == null || input.isEmpty()) {
            return new ParseResult(entries, errors);
        }

        int n = input.length();
        int i = 0;
        while (i < n) {
            int at = input.indexOf('@', i);
            if (at < 0) break;

            int typeStart = skipWhitespace(input, at + 1);
            int typeEnd = scanName(input, typeStart);
            if (typeEnd == typeStart) {
                i = at + 1;
                continue;
            }
            String type = input.substring(typeStart, typeEnd).toLowerCase(Locale.ROOT);

            int open = skipWhitespace(input, typeEnd);
            if (open >= n) break;
            char openChar = input.charAt(open);
            if (openChar != '{' && openChar != '(') {
                i = open + 1;
                continue;
            }
            char closeChar = openChar == '{' ? '}' : ')';

            int end = scanBalanced(input, open, openChar, closeChar);
            if (end < 0) {
                errors.add("Unclosed entry starting at index " + at + " (@" + type + ")");
                break;
            }

            if (!type.equals("comment") && !type.equals("preamble") && !type.equals("string")) {
                String key = readKey(input, open + 1, end - 1, closeChar);
                if (key == null) {
                    errors.add("Entry without key at index " + at + " (@" + type + ")");
                } else {
                    entries.add(new RawEntry(type, key, input.substring(at, end).trim()));
                }
            }
            i = end;
        }
        return new ParseResult(entries, errors);
    }

    /**
     * Value of one field of a raw entry with outer delimiters removed and whitespace collapsed,
     * or null when absent. Inner braces are preserved.
     */
    public static String extractField(String rawEntry, String fieldName) {
        if (rawEntry == null || fieldName == null) return null;
        return extractFields(rawEntry).get(fieldName.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * All top-level fields of a raw entry, keyed by lower-cased name, in source order.
     * The first occurrence of a repeated field wins.
     */
    public static Map<String, String> extractFields(String rawEntry) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (rawEntry == null) return fields;

        int n = rawEntry.length();
        int open = 0;
        while (open < n && rawEntry.charAt(open) != '{' && rawEntry.charAt(open) != '(') open++;
        if (open >= n) return fields;
        char closeChar = rawEntry.charAt(open) == '{' ? '}' : ')';

        // Skip the key.
        int p = indexOfTopLevel(rawEntry, open + 1, ',', closeChar);
        if (p < 0) return fields;
        p++;

        while (p < n) {
            p = skipSeparators(rawEntry, p);
            if (p >= n || rawEntry.charAt(p) == closeChar) break;

            int nameEnd = scanName(rawEntry, p);
            if (nameEnd == p) break;
            String name = rawEntry.substring(p, nameEnd).toLowerCase(Locale.ROOT);

            int eq = skipWhitespace(rawEntry, nameEnd);
            if (eq >= n || rawEntry.charAt(eq) != '=') break;
            int valueStart = skipWhitespace(rawEntry, eq + 1);
            if (valueStart >= n) break;

            String value;
            char c = rawEntry.charAt(valueStart);
            if (c == '{') {
                int end = scanBalanced(rawEntry, valueStart, '{', '}');
                if (end < 0) break;
                value = rawEntry.substring(valueStart + 1, end - 1);
                p = end;
            } else if (c == '"') {
                int end = scanQuoted(rawEntry, valueStart);
                if (end < 0) break;
                value = rawEntry.substring(valueStart + 1, end - 1);
                p = end;
            } else {
                int end = valueStart;
                while (end < n && rawEntry.charAt(end) != ',' && rawEntry.charAt(end) != closeChar) end++;
                value = rawEntry.substring(valueStart, end);
                p = end;
            }
            fields.putIfAbsent(name, value.replaceAll("\\s+", " ").trim());
        }
        return fields;
    }

    /**
     * Index just past the delimiter closing the one at {@code open}, or -1 if unbalanced.
     *
     * <p>Braces are counted everywhere, as BibTeX requires them balanced even inside quoted values.
     * For a parenthesised entry the closing parenthesis must sit outside braces and quotes.
     */
    static int scanBalanced(String s, int open, char openChar, char closeChar) {
        if (openChar == '{') {
            int depth = 0;
            boolean escaped = false;
            for (int p = open; p < s.length(); p++) {
                char c = s.charAt(p);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '{') {
                    depth++;
                } else if (c == '}' && --depth == 0) {
                    return p + 1;
                }
            }
            return -1;
        }
        int close = indexOfTopLevel(s, open + 1, closeChar, '\0');
        return close < 0 ? -1 : close + 1;
    }

    private static int scanQuoted(String s, int open) {
        boolean escaped = false;
        int braces = 0;
        for (int p = open + 1; p < s.length(); p++) {
            char c = s.charAt(p);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '{') {
                braces++;
            } else if (c == '}') {
                braces = Math.max(0, braces - 1);
            } else if (c == '"' && braces == 0) {
                return p + 1;
            }
        }
        return -1;
    }

    private static String readKey(String s, int from, int bodyEnd, char closeChar) {
        int comma = indexOfTopLevel(s, from, ',', closeChar);
        int end = comma < 0 || comma > bodyEnd ? bodyEnd : comma;
        String key = s.substring(from, end).trim();
        if (key.isEmpty() || key.contains("=")) return null;
        return key;
    }

    /**
     * First {@code target} at brace depth zero and outside quotes, stopping at an unmatched
     * {@code stop}; -1 if none.
     */
    private static int indexOfTopLevel(String s, int from, char target, char stop) {
        int depth = 0;
        boolean inQuotes = false;
        boolean escaped = false;
        for (int p = from; p < s.length(); p++) {
            char c = s.charAt(p);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"' && depth == 0) {
                inQuotes = !inQuotes;
            } else if (!inQuotes) {
                if (c == '{') depth++;
                else if (c == '}' && depth > 0) depth--;
                else if (depth == 0 && c == target) return p;
                else if (depth == 0 && c == stop) return -1;
            }
        }
        return -1;
    }

    private static int scanName(String s, int from) {
        int p = from;
        while (p < s.length()) {
            char c = s.charAt(p);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == ':' || c == '.') p++;
            else break;
        }
        return p;
    }

    private static int skipWhitespace(String s, int from) {
        int p = from;
        while (p < s.length() && Character.isWhitespace(s.charAt(p))) p++;
        return p;
    }

    private static int skipSeparators(String s, int from) {
        int p = from;
        while (p < s.length() && (Character.isWhitespace(s.charAt(p)) || s.charAt(p) == ',')) p++;
        return p;
    }
}
