package com.apareferences;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns BibTeX source into {@link Entry} graphs.
 *
 * <p>Container fields ({@code journal}, {@code booktitle}) become parent entries so the classifier
 * sees the same shape a hand-built record would have; {@code crossref} points at another entry
 * of the same file, which is then used as the parent. Unreadable values are dropped and reported
 * in {@link ReadResult#errors()}.
 */
public final class BibTeXEntryReader {

    private static final Logger log = LoggerFactory.getLogger(BibTeXEntryReader.class);

    private static final Pattern RANGE = Pattern.compile("^\\s*(\\d+)\\s*(?:-{1,2}|–)\\s*(\\d+)\\s*$");
    private static final Pattern NUMBER = Pattern.compile("^\\s*(\\d+)\\s*$");
    private static final Pattern AND = Pattern.compile("\\s+and\\s+", Pattern.CASE_INSENSITIVE);

    public record ReadResult(List<Entry> entries, List<String> errors) {}

    private final Map<String, BibTeXParser.RawEntry> byKey = new HashMap<>();
    private final List<String> errors = new ArrayList<>();

    private BibTeXEntryReader() {
    }

    public static ReadResult read(String input) {
        BibTeXParser.ParseResult parsed = BibTeXParser.parseEntries(input);
        BibTeXEntryReader reader = new BibTeXEntryReader();
        reader.errors.addAll(parsed.errors());
        for (BibTeXParser.RawEntry raw : parsed.entries()) {
            reader.byKey.putIfAbsent(raw.key().toLowerCase(Locale.ROOT), raw);
        }

        List<Entry> entries = new ArrayList<>();
        for (BibTeXParser.RawEntry raw : parsed.entries()) {
            try {
                entries.add(reader.convert(raw, true));
            } catch (IllegalArgumentException e) {
                reader.errors.add("Entry '" + raw.key() + "' skipped: " + e.getMessage());
            }
        }
        for (String error : reader.errors) {
            log.warn("BibTeX: {}", error);
        }
        return new ReadResult(entries, List.copyOf(reader.errors));
    }

    private Entry convert(BibTeXParser.RawEntry raw, boolean resolveCrossref) {
        Map<String, String> f = BibTeXParser.extractFields(raw.raw());
        EntryType type = typeOf(raw.type());
        Entry.Builder b = Entry.builder(type).key(raw.key());

        b.title(latex(f.get("title")));
        b.authors(persons(f.get("author")));
        date(raw.key(), f).ifPresent(b::date);
        b.serialNumber(plain(Optional.ofNullable(f.get("eid")).orElse(f.get("articleno"))));
        pages(f.get("pages"), b);
        url(raw.key(), f).ifPresent(b::url);
        b.archive(plain(f.get("archive")));

        Entry crossrefParent = resolveCrossref ? crossref(raw.key(), f.get("crossref")) : null;

        switch (raw.type()) {
            case "article" -> {
                if (f.containsKey("journal") || f.containsKey("journaltitle")) {
                    Entry.Builder journal = Entry.builder(EntryType.PERIODICAL)
                            .title(latex(Optional.ofNullable(f.get("journal")).orElse(f.get("journaltitle"))))
                            .issue(plain(f.get("number")));
                    volume(raw.key(), f.get("volume")).ifPresent(journal::volume);
                    b.parent(journal.build());
                } else {
                    volume(raw.key(), f.get("volume")).ifPresent(b::volume);
                    b.issue(plain(f.get("number")));
                    if (crossrefParent != null) b.parent(crossrefParent);
                }
                b.publisher(plain(f.get("publisher")));
            }
            case "incollection", "inbook", "inreference" -> b.parent(crossrefParent != null
                    ? crossrefParent
                    : container(raw.key(), raw.type().equals("inreference") ? EntryType.REFERENCE : EntryType.ANTHOLOGY, f));
            case "inproceedings", "conference" -> b.parent(crossrefParent != null
                    ? crossrefParent
                    : container(raw.key(), EntryType.PROCEEDINGS, f));
            default -> {
                b.editors(persons(f.get("editor")));
                edition(raw.key(), f.get("edition")).ifPresent(b::edition);
                volume(raw.key(), f.get("volume")).ifPresent(b::volume);
                b.issue(plain(f.get("number")));
                b.publisher(plain(f.get("publisher")));
                b.organization(plain(organization(f)));
                if (crossrefParent != null) b.parent(crossrefParent);
            }
        }
        return b.build();
    }

    /**
     * A synthetic parent built from the {@code booktitle} family of fields.
     */
    private Entry container(String key, EntryType type, Map<String, String> f) {
        Entry.Builder c = Entry.builder(type)
                .title(latex(f.get("booktitle")))
                .editors(persons(f.get("editor")))
                .publisher(plain(f.get("publisher")))
                .organization(plain(organization(f)));
        edition(key, f.get("edition")).ifPresent(c::edition);
        volume(key, f.get("volume")).ifPresent(c::volume);
        return c.build();
    }

    private Entry crossref(String key, String target) {
        if (target == null || target.isBlank()) return null;
        BibTeXParser.RawEntry parent = byKey.get(target.trim().toLowerCase(Locale.ROOT));
        if (parent == null) {
            errors.add("Entry '" + key + "' cross-references unknown key '" + target + "'");
            return null;
        }
        return convert(parent, false);
    }

    static EntryType typeOf(String bibType) {
        return switch (bibType) {
            case "article" -> EntryType.ARTICLE;
            case "incollection", "inbook" -> EntryType.IN_ANTHOLOGY;
            case "inreference" -> EntryType.ENTRY;
            case "inproceedings", "conference" -> EntryType.ARTICLE;
            case "book", "mvbook", "booklet" -> EntryType.BOOK;
            case "collection", "mvcollection" -> EntryType.ANTHOLOGY;
            case "proceedings", "mvproceedings" -> EntryType.PROCEEDINGS;
            case "reference", "mvreference" -> EntryType.REFERENCE;
            case "manual", "techreport", "report" -> EntryType.REPORT;
            case "phdthesis", "mastersthesis", "thesis" -> EntryType.THESIS;
            case "unpublished" -> EntryType.MANUSCRIPT;
            case "online", "www", "electronic" -> EntryType.WEB_ITEM;
            case "periodical" -> EntryType.PERIODICAL;
            case "video", "movie" -> EntryType.VIDEO;
            case "audio", "music" -> EntryType.AUDIO;
            case "artwork" -> EntryType.ARTWORK;
            case "patent" -> EntryType.PATENT;
            default -> EntryType.MISC;
        };
    }

    private static String organization(Map<String, String> f) {
        for (String name : List.of("organization", "institution", "school")) {
            if (f.containsKey(name)) return f.get(name);
        }
        return null;
    }

    /**
     * Splits an {@code author}/{@code editor} field on top-level {@code and}. Accepts
     * {@code "Last, First"}, {@code "von Last, Jr, First"} and {@code "First von Last"};
     * a fully braced name is kept whole as a family name.
     */
    static List<Person> persons(String field) {
        List<Person> out = new ArrayList<>();
        if (field == null || field.isBlank()) return out;
        for (String part : splitTopLevel(field)) {
            String name = part.trim();
            if (name.isEmpty() || name.equalsIgnoreCase("others")) continue;
            if (name.startsWith("{") && name.endsWith("}") && BibTeXParser.scanBalanced(name, 0, '{', '}') == name.length()) {
                String corporate = plain(name.substring(1, name.length() - 1));
                if (!corporate.isEmpty()) out.add(Person.of(corporate, null));
                continue;
            }
            String[] commas = plain(name).split("\\s*,\\s*");
            if (commas.length == 0 || commas[0].isBlank()) continue;
            if (commas.length >= 3) {
                out.add(Person.parse(commas[0], commas[2], commas[1]));
            } else if (commas.length == 2) {
                out.add(Person.parse(commas[0], commas[1]));
            } else {
                out.add(firstLast(commas[0]));
            }
        }
        return out;
    }

    private static Person firstLast(String name) {
        String[] words = name.trim().split("\\s+");
        if (words.length == 1) return Person.parse(words[0], null);
        int vonStart = words.length - 1;
        // A leading lower-case word is a particle, not a given name: "van Beethoven".
        for (int i = 0; i < words.length - 1; i++) {
            if (Character.isLowerCase(words[i].codePointAt(0))) {
                vonStart = i;
                break;
            }
        }
        String given = vonStart == 0 ? null : String.join(" ", List.of(words).subList(0, vonStart));
        String family = String.join(" ", List.of(words).subList(vonStart, words.length));
        return Person.parse(family, given);
    }

    private static List<String> splitTopLevel(String field) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < field.length(); i++) {
            char c = field.charAt(i);
            if (c == '{') depth++;
            else if (c == '}') depth = Math.max(0, depth - 1);
            else if (depth == 0 && Character.isWhitespace(c)) {
                Matcher m = AND.matcher(field).region(i, field.length());
                if (m.lookingAt()) {
                    parts.add(field.substring(start, i));
                    start = m.end();
                    i = m.end() - 1;
                }
            }
        }
        parts.add(field.substring(start));
        return parts;
    }

    private Optional<EntryDate> date(String key, Map<String, String> f) {
        String iso = f.get("date");
        if (iso != null) {
            Optional<EntryDate> parsed = EntryDate.parseIso(iso);
            if (parsed.isEmpty()) errors.add("Entry '" + key + "' has unreadable date '" + iso + "'");
            return parsed;
        }
        String year = f.get("year");
        if (year == null) return Optional.empty();
        Matcher y = NUMBER.matcher(plain(year));
        if (!y.matches()) {
            errors.add("Entry '" + key + "' has non-numeric year '" + year + "'");
            return Optional.empty();
        }
        Integer month = f.containsKey("month") ? EnglishCalendarNames.parseMonthNumber(f.get("month")) : null;
        if (f.containsKey("month") && month == null) {
            errors.add("Entry '" + key + "' has unreadable month '" + f.get("month") + "'");
        }
        try {
            Integer day = null;
            if (month != null && f.containsKey("day")) {
                Matcher d = NUMBER.matcher(f.get("day"));
                if (d.matches()) day = Integer.valueOf(d.group(1));
            }
            return Optional.of(new EntryDate(Integer.parseInt(y.group(1)), month, day));
        } catch (IllegalArgumentException e) {
            errors.add("Entry '" + key + "': " + e.getMessage());
            return Optional.empty();
        }
    }

    private static void pages(String pages, Entry.Builder b) {
        if (pages == null) return;
        Optional<NumberRange> range = parseRange(pages);
        if (range.isPresent()) {
            b.pageRange(range.get());
        } else {
            // Article numbers such as "e0123" sometimes sit in the pages field.
            b.serialNumber(plain(pages));
        }
    }

    private Optional<NumberRange> volume(String key, String volume) {
        if (volume == null) return Optional.empty();
        Optional<NumberRange> range = parseRange(volume);
        if (range.isEmpty()) {
            errors.add("Entry '" + key + "' has non-numeric volume '" + volume + "'");
        }
        return range;
    }

    static Optional<NumberRange> parseRange(String text) {
        Matcher r = RANGE.matcher(text);
        try {
            if (r.matches()) {
                return Optional.of(new NumberRange(Long.parseLong(r.group(1)), Long.parseLong(r.group(2))));
            }
            Matcher n = NUMBER.matcher(text);
            if (n.matches()) {
                return Optional.of(NumberRange.single(Long.parseLong(n.group(1))));
            }
        } catch (IllegalArgumentException e) {
            log.debug("Unusable range '{}': {}", text, e.getMessage());
        }
        return Optional.empty();
    }

    private Optional<Edition> edition(String key, String edition) {
        if (edition == null || edition.isBlank()) return Optional.empty();
        Matcher n = NUMBER.matcher(edition);
        if (n.matches()) {
            try {
                return Optional.of(Edition.of(Long.parseLong(n.group(1))));
            } catch (NumberFormatException e) {
                errors.add("Entry '" + key + "' has out-of-range edition '" + edition + "', kept as text");
            }
        }
        return Optional.of(Edition.of(plain(edition)));
    }

    private Optional<QualifiedUrl> url(String key, Map<String, String> f) {
        String url = f.get("url");
        if (url == null || url.isBlank()) return Optional.empty();
        EntryDate visited = null;
        String urldate = f.get("urldate");
        if (urldate != null) {
            visited = EntryDate.parseIso(urldate).orElse(null);
            if (visited == null) errors.add("Entry '" + key + "' has unreadable urldate '" + urldate + "'");
        }
        return Optional.of(new QualifiedUrl(url.trim(), visited));
    }

    /**
     * Undoes the common LaTeX escapes. Braces in titles are kept: they mark text that must not be
     * re-cased.
     */
    static String latex(String value) {
        if (value == null) return null;
        return value.replace("\\&", "&")
                .replace("\\%", "%")
                .replace("\\_", "_")
                .replace("--", "–")
                .trim();
    }

    /**
     * {@link #latex(String)} with all braces removed, for fields that are never re-cased.
     */
    static String plain(String value) {
        if (value == null) return null;
        return latex(value).replace("{", "").replace("}", "").trim();
    }
}
