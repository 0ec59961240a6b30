package com.apareferences;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds complete APA reference-list entries:
 * {@code "{Authors} {Date}. {Title} {Source} {Retrieval}"}.
 *
 * <p>Segments that render empty are dropped. Instances hold no mutable state and may be shared
 * between threads.
 */
public final class ApaReferenceFormatter {

    private final NameFormatter names;
    private final DateFormatter dates;
    private final TitleFormatter titles;
    private final SourceFormatter sources;

    /**
     * Formatter using the options from {@link ApaOptions#load()}.
     */
    public ApaReferenceFormatter() {
        this(ApaOptions.load());
    }

    public ApaReferenceFormatter(ApaOptions options) {
        this(options, SentenceCase.DEFAULT, EnglishCalendarNames.INSTANCE);
    }

    public ApaReferenceFormatter(ApaOptions options, SentenceCaseTransformer sentenceCase, CalendarNames calendar) {
        this.names = new NameFormatter(options);
        this.dates = new DateFormatter(calendar, options);
        this.titles = new TitleFormatter(sentenceCase, calendar);
        this.sources = new SourceFormatter(names, titles, sentenceCase);
    }

    public String format(Entry entry) {
        SourceType sourceType = EntryTypeClassifier.classify(entry);

        List<String> segments = new ArrayList<>();
        segments.add(names.renderNameList(entry.authors()));
        segments.add(ClauseBuilder.withPeriod(dates.renderDate(entry)));
        segments.add(titles.renderTitle(entry).orElse(""));
        segments.add(sources.renderSource(entry, sourceType));
        segments.add(dates.renderRetrievalDate(entry).orElse(""));

        return join(segments);
    }

    /**
     * Formats each entry independently, preserving order.
     */
    public List<String> formatAll(List<Entry> entries) {
        List<String> out = new ArrayList<>(entries.size());
        for (Entry e : entries) {
            out.add(format(e));
        }
        return out;
    }

    static String join(List<String> segments) {
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            if (segment == null) continue;
            String s = segment.strip();
            if (s.isEmpty()) continue;
            if (sb.length() > 0) {
                if (s.charAt(0) == '.' && endsWithTerminal(sb)) {
                    s = s.substring(1).strip();
                    if (s.isEmpty()) continue;
                }
                sb.append(' ');
            }
            sb.append(s);
        }
        return sb.toString().replaceAll("\\s+", " ");
    }

    private static boolean endsWithTerminal(CharSequence cs) {
        char last = cs.charAt(cs.length() - 1);
        return last == '.' || last == '?' || last == '!';
    }
}
