package com.apareferences;

import java.util.List;
import java.util.Optional;

/**
 * Renders the venue clause of a reference: the journal, the edited collection, the archive or
 * the publisher, depending on the entry's {@link SourceType}.
 *
 * <p>Container fields are read from the parent the classifier matched, not from the first parent.
 */
public final class SourceFormatter {

    private final NameFormatter names;
    private final TitleFormatter titles;
    private final SentenceCaseTransformer sentenceCase;

    public SourceFormatter() {
        this(new NameFormatter(), new TitleFormatter(), SentenceCase.DEFAULT);
    }

    public SourceFormatter(NameFormatter names, TitleFormatter titles, SentenceCaseTransformer sentenceCase) {
        this.names = names;
        this.titles = titles;
        this.sentenceCase = sentenceCase;
    }

    public String renderSource(Entry entry) {
        return renderSource(entry, EntryTypeClassifier.classify(entry));
    }

    public String renderSource(Entry entry, SourceType sourceType) {
        Entry parent = sourceType.parent(entry).orElse(null);
        return switch (sourceType.shape()) {
            case PERIODICAL_ITEM -> periodicalItem(entry, parent);
            case COLLECTION_ITEM -> containedIn(parent, parent.editors().isEmpty() ? entry.editors() : parent.editors());
            case TV_SERIES -> containedIn(parent, producers(entry, parent));
            case THESIS -> new ClauseBuilder().add(entry.archive().or(entry::organization).orElse(null)).terminate();
            case MANUSCRIPT -> new ClauseBuilder().add(entry.archive().orElse(null)).terminate();
            case ART_CONTAINER -> artContainer(parent);
            case STANDALONE_ART -> new ClauseBuilder()
                    .add(entry.organization().orElse(null))
                    .add(entry.publisher().orElse(null))
                    .terminate();
            case STANDALONE_WEB_ITEM -> new ClauseBuilder().add(entry.publisherOrOrganization().orElse(null)).terminate();
            case WEB_ITEM -> new ClauseBuilder()
                    .add(containerTitle(parent))
                    .add(parent.publisherOrOrganization().or(entry::publisherOrOrganization).orElse(null))
                    .terminate();
            case NEWS_ITEM -> new ClauseBuilder()
                    .add(containerTitle(parent))
                    .add(volumeIssue(parent, null))
                    .add(entry.pageRange().map(Ranges::format).orElse(null))
                    .terminate();
            case CONFERENCE_TALK -> new ClauseBuilder()
                    .add(containerTitle(parent))
                    .add(parent.organization().or(parent::publisher).orElse(null))
                    .terminate();
            case GENERIC -> new ClauseBuilder().add(entry.publisherOrOrganization().orElse(null)).terminate();
        };
    }

    private String periodicalItem(Entry entry, Entry parent) {
        String locator = entry.serialNumber()
                .or(() -> entry.pageRange().map(Ranges::format))
                .orElse(null);
        return new ClauseBuilder()
                .add(containerTitle(parent))
                .add(volumeIssue(parent, entry))
                .add(locator)
                .terminate();
    }

    /**
     * {@code "In Editors (Eds.), Container title (2nd ed.). Publisher."}
     */
    private String containedIn(Entry parent, List<Person> credited) {
        ClauseBuilder clause = new ClauseBuilder();
        if (credited.size() == 1) {
            clause.add(names.renderName(credited.get(0)) + " (Ed.)");
        } else if (credited.size() > 1) {
            clause.add(names.renderNameList(credited) + " (Eds.)");
        }
        clause.add(titles.renderContainerTitle(parent));

        StringBuilder sb = new StringBuilder();
        if (!clause.isEmpty()) {
            sb.append("In ").append(clause.terminate());
        }
        parent.publisherOrOrganization().ifPresent(p -> {
            if (sb.length() > 0) sb.append(' ');
            sb.append(ClauseBuilder.withPeriod(p));
        });
        return sb.toString();
    }

    private String artContainer(Entry parent) {
        String title = containerTitle(parent);
        return new ClauseBuilder()
                .add(title == null ? null : "In " + title)
                .add(parent.organization().or(parent::publisher).orElse(null))
                .terminate();
    }

    /**
     * Executive producers credited on the series, or the episode's own authors when none are.
     */
    private static List<Person> producers(Entry entry, Entry parent) {
        List<Person> producers = parent.affiliated(PersonRole.EXECUTIVE_PRODUCER);
        return producers.isEmpty() ? entry.authors() : producers;
    }

    private String containerTitle(Entry parent) {
        return parent.title(sentenceCase).orElse(null);
    }

    /**
     * {@code "12(3)"}, {@code "12"} or {@code "(3)"}; values on {@code container} win over those on
     * {@code fallback}, which may be null.
     */
    private static String volumeIssue(Entry container, Entry fallback) {
        Optional<NumberRange> volume = container.volume();
        Optional<String> issue = container.issue();
        if (fallback != null) {
            volume = volume.or(fallback::volume);
            issue = issue.or(fallback::issue);
        }
        String out = volume.map(Ranges::format).orElse("") + issue.map(i -> "(" + i + ")").orElse("");
        return out.isEmpty() ? null : out;
    }
}
