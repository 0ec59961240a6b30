package com.apareferences;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Renders sentence-cased titles with their closing qualifiers.
 */
public final class TitleFormatter {

    static final EntryTypeSpec MULTIVOLUME =
            EntryTypeSpec.withParent(Modality.specific(EntryType.BOOK), Modality.specific(EntryType.BOOK));

    static final EntryTypeSpec BOOK_LIKE = EntryTypeSpec.of(Modality.alternate(
            EntryType.BOOK, EntryType.REPORT, EntryType.REFERENCE, EntryType.ANTHOLOGY, EntryType.PROCEEDINGS));

    private final SentenceCaseTransformer sentenceCase;
    private final CalendarNames calendar;

    public TitleFormatter() {
        this(SentenceCase.DEFAULT, EnglishCalendarNames.INSTANCE);
    }

    public TitleFormatter(SentenceCaseTransformer sentenceCase, CalendarNames calendar) {
        this.sentenceCase = sentenceCase;
        this.calendar = calendar;
    }

    /**
     * The entry's title, or empty if it has none. Exactly one of these endings is applied:
     * <ul>
     *   <li>a volume of a multivolume book: {@code "Parent title: Vol. 2 This title."}</li>
     *   <li>a book-like work with edition or volume: {@code "Title (2nd ed., Vol. 4)."}</li>
     *   <li>otherwise a period, unless the title already ends in {@code ?}, {@code .} or {@code !}</li>
     * </ul>
     */
    public Optional<String> renderTitle(Entry entry) {
        Optional<String> title = entry.title(sentenceCase);
        if (title.isEmpty()) return Optional.empty();
        String res = title.get();

        Optional<String> nested = multivolumePrefix(entry);
        if (nested.isPresent()) {
            return Optional.of(ClauseBuilder.withPeriod(nested.get() + " " + res));
        }
        if ((entry.volume().isPresent() || entry.edition().isPresent()) && BOOK_LIKE.matches(entry)) {
            return Optional.of(res + editionVolumeSuffix(entry));
        }
        return Optional.of(ClauseBuilder.withPeriod(res));
    }

    /**
     * Title of this entry with its own edition/volume parenthetical or a closing period.
     * Used for container titles, where the book-like restriction does not apply.
     */
    String renderContainerTitle(Entry container) {
        Optional<String> title = container.title(sentenceCase);
        if (title.isEmpty()) return null;
        if (container.volume().isPresent() || container.edition().isPresent()) {
            return title.get() + editionVolumeSuffix(container);
        }
        return ClauseBuilder.withPeriod(title.get());
    }

    /**
     * {@code " (2nd ed.)."}, {@code " (Vol. 4)."}, {@code " (2nd ed., Vol. 4)."}, or empty when the
     * entry has neither edition nor volume.
     */
    public String editionVolumeSuffix(Entry entry) {
        String vol = entry.volume().map(Ranges::volumes).orElse(null);
        String ed = entry.edition().map(this::edition).orElse(null);

        if (ed == null && vol == null) return "";
        if (vol == null) return " (" + ed + " ed.).";
        if (ed == null) return " (" + vol + ").";
        return " (" + ed + " ed., " + vol + ").";
    }

    private Optional<String> multivolumePrefix(Entry entry) {
        if (entry.volume().isEmpty()) return Optional.empty();
        OptionalInt parentIndex = MULTIVOLUME.matchingParent(entry);
        if (parentIndex.isEmpty()) return Optional.empty();
        Entry parent = entry.parents().get(parentIndex.getAsInt());
        return parent.title(sentenceCase)
                .map(t -> t + ": " + Ranges.volumes(entry.volume().get()));
    }

    private String edition(Edition edition) {
        return edition.isNumber() ? calendar.ordinal(edition.number()) : edition.label();
    }
}
