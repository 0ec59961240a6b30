package com.apareferences;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalInt;
import java.util.function.Predicate;

import static com.apareferences.EntryType.*;

/**
 * Decides which {@link SourceType} an entry is cited as.
 *
 * <p>Rules are tried top to bottom and the first match wins, so their order is significant: an
 * article in a periodical that would also pass the web rules is still a periodical item.
 * {@link SourceType.Shape#GENERIC} is the fallback.
 */
public final class EntryTypeClassifier {

    private static final Logger log = LoggerFactory.getLogger(EntryTypeClassifier.class);

    /**
     * One step of the cascade: alternatives tried in order, an optional extra guard, and the shape
     * produced on a match.
     */
    record Rule(String name, SourceType.Shape shape, List<EntryTypeSpec> alternatives, Predicate<Entry> guard) {

        Rule(String name, SourceType.Shape shape, EntryTypeSpec... alternatives) {
            this(name, shape, List.of(alternatives), e -> true);
        }

        SourceType apply(Entry entry) {
            if (!guard.test(entry)) {
                return null;
            }
            for (EntryTypeSpec spec : alternatives) {
                if (shape.withParent()) {
                    OptionalInt index = spec.matchingParent(entry);
                    if (index.isPresent()) {
                        return SourceType.of(shape, entry, index.getAsInt());
                    }
                } else if (spec.matches(entry)) {
                    return SourceType.of(shape);
                }
            }
            return null;
        }
    }

    static final List<Rule> RULES = List.of(
            new Rule("periodical", SourceType.Shape.PERIODICAL_ITEM,
                    EntryTypeSpec.withParent(Modality.any(), Modality.specific(PERIODICAL))),
            new Rule("collection", SourceType.Shape.COLLECTION_ITEM,
                    EntryTypeSpec.withParent(Modality.specific(IN_ANTHOLOGY), Modality.specific(ANTHOLOGY)),
                    EntryTypeSpec.withParent(Modality.specific(ENTRY), Modality.any()),
                    EntryTypeSpec.withParent(Modality.any(), Modality.specific(REFERENCE)),
                    EntryTypeSpec.withParent(Modality.specific(ARTICLE), Modality.specific(PROCEEDINGS))),
            new Rule("tv-series", SourceType.Shape.TV_SERIES,
                    List.of(EntryTypeSpec.withParent(Modality.specific(VIDEO), Modality.specific(VIDEO))),
                    e -> e.issue().isPresent() && e.volume().isPresent()),
            new Rule("thesis", SourceType.Shape.THESIS, EntryTypeSpec.single(THESIS)),
            new Rule("manuscript", SourceType.Shape.MANUSCRIPT, EntryTypeSpec.single(MANUSCRIPT)),
            new Rule("art-container", SourceType.Shape.ART_CONTAINER,
                    EntryTypeSpec.withParent(Modality.any(), Modality.specific(ARTWORK))),
            new Rule("art", SourceType.Shape.STANDALONE_ART,
                    EntryTypeSpec.of(Modality.alternate(ARTWORK, EXHIBITION))),
            new Rule("web-standalone", SourceType.Shape.STANDALONE_WEB_ITEM, EntryTypeSpec.single(WEB_ITEM)),
            new Rule("web-contained", SourceType.Shape.WEB_ITEM,
                    EntryTypeSpec.withParent(Modality.any(), Modality.alternate(MISC, BLOG, WEB_ITEM)),
                    EntryTypeSpec.withParent(Modality.specific(WEB_ITEM), Modality.any())),
            new Rule("conference-talk", SourceType.Shape.CONFERENCE_TALK,
                    EntryTypeSpec.withParent(Modality.any(), Modality.specific(CONFERENCE))),
            new Rule("news", SourceType.Shape.NEWS_ITEM,
                    EntryTypeSpec.withParent(Modality.any(), Modality.specific(NEWSPAPER_ISSUE)))
    );

    private EntryTypeClassifier() {
    }

    public static SourceType classify(Entry entry) {
        for (Rule rule : RULES) {
            SourceType result = rule.apply(entry);
            if (result != null) {
                log.debug("{} classified as {} by rule '{}'", entry, result, rule.name());
                return result;
            }
        }
        log.debug("{} fell through to generic", entry);
        return SourceType.of(SourceType.Shape.GENERIC);
    }
}
