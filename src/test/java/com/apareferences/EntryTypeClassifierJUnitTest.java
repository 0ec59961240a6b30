package com.apareferences;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.apareferences.SourceType.Shape.*;
import static org.junit.jupiter.api.Assertions.*;

class EntryTypeClassifierJUnitTest {

    private static Entry parent(EntryType type) {
        return Entry.builder(type).title(type.name()).build();
    }

    private static Entry child(EntryType type, EntryType... parentTypes) {
        Entry.Builder b = Entry.builder(type);
        for (EntryType p : parentTypes) {
            b.parent(parent(p));
        }
        return b.build();
    }

    private static void assertShape(SourceType.Shape expected, Entry entry) {
        assertEquals(expected, EntryTypeClassifier.classify(entry).shape(), entry.toString());
    }

    @Test
    void classify_periodicalItemCarriesMatchingParentIndex() {
        Entry article = child(EntryType.ARTICLE, EntryType.BLOG, EntryType.PERIODICAL);
        SourceType st = EntryTypeClassifier.classify(article);

        assertEquals(PERIODICAL_ITEM, st.shape());
        assertEquals(1, st.parentIndex());
        assertEquals(EntryType.PERIODICAL, st.parent(article).orElseThrow().type());
    }

    @Test
    void classify_periodicalWinsOverLaterRules() {
        // Also eligible for the web rule (Blog parent) and the thesis rule.
        assertShape(PERIODICAL_ITEM, child(EntryType.WEB_ITEM, EntryType.BLOG, EntryType.PERIODICAL));
        assertShape(PERIODICAL_ITEM, child(EntryType.THESIS, EntryType.PERIODICAL));
    }

    @Test
    void classify_collectionAlternatives() {
        assertShape(COLLECTION_ITEM, child(EntryType.IN_ANTHOLOGY, EntryType.ANTHOLOGY));
        assertShape(COLLECTION_ITEM, child(EntryType.ENTRY, EntryType.BOOK));
        assertShape(COLLECTION_ITEM, child(EntryType.CHAPTER, EntryType.REFERENCE));
        assertShape(COLLECTION_ITEM, child(EntryType.ARTICLE, EntryType.PROCEEDINGS));
    }

    @Test
    void classify_collectionTakesIndexFromFirstSatisfiedAlternative() {
        Entry entry = child(EntryType.ENTRY, EntryType.MISC, EntryType.REFERENCE);
        SourceType st = EntryTypeClassifier.classify(entry);

        assertEquals(COLLECTION_ITEM, st.shape());
        assertEquals(0, st.parentIndex());
    }

    @Test
    void classify_tvSeriesNeedsIssueAndVolume() {
        Entry episode = Entry.builder(EntryType.VIDEO).parent(parent(EntryType.VIDEO)).issue("3").volume(2).build();
        assertShape(TV_SERIES, episode);

        Entry noIssue = Entry.builder(EntryType.VIDEO).parent(parent(EntryType.VIDEO)).volume(2).build();
        assertShape(GENERIC, noIssue);
    }

    @Test
    void classify_tvSeriesSkippedFallsThroughToLaterRules() {
        Entry clip = Entry.builder(EntryType.VIDEO)
                .parent(parent(EntryType.VIDEO))
                .parent(parent(EntryType.CONFERENCE))
                .build();
        assertShape(CONFERENCE_TALK, clip);
    }

    @Test
    void classify_shapeOnlyRules() {
        assertShape(THESIS, child(EntryType.THESIS));
        assertShape(MANUSCRIPT, child(EntryType.MANUSCRIPT));
        assertShape(STANDALONE_ART, child(EntryType.ARTWORK));
        assertShape(STANDALONE_ART, child(EntryType.EXHIBITION));
        assertShape(STANDALONE_WEB_ITEM, child(EntryType.WEB_ITEM));
        assertShape(GENERIC, child(EntryType.BOOK));
    }

    @Test
    void classify_thesisIgnoresUnrelatedParents() {
        assertShape(THESIS, child(EntryType.THESIS, EntryType.MISC));
    }

    @Test
    void classify_containerRules() {
        assertShape(ART_CONTAINER, child(EntryType.SCENE, EntryType.ARTWORK));
        assertShape(WEB_ITEM, child(EntryType.ARTICLE, EntryType.BLOG));
        assertShape(WEB_ITEM, child(EntryType.THREAD, EntryType.MISC));
        assertShape(CONFERENCE_TALK, child(EntryType.AUDIO, EntryType.CONFERENCE));
        assertShape(NEWS_ITEM, child(EntryType.ARTICLE, EntryType.NEWSPAPER_ISSUE));
    }

    @Test
    void classify_standaloneWebItemPrecedesContainedWebItem() {
        assertShape(STANDALONE_WEB_ITEM, child(EntryType.WEB_ITEM, EntryType.BLOG));
    }

    @Test
    void classify_entriesWithoutParentsNeverGetParentShapes() {
        for (EntryType type : EntryType.values()) {
            Entry entry = Entry.builder(type).issue("1").volume(1).build();
            SourceType st = EntryTypeClassifier.classify(entry);
            assertFalse(st.shape().withParent(), type + " classified as " + st);
            assertNull(st.parentIndex());
        }
    }

    @Test
    void rules_areOrderedByPrecedence() {
        List<String> names = EntryTypeClassifier.RULES.stream().map(EntryTypeClassifier.Rule::name).toList();
        assertEquals(List.of("periodical", "collection", "tv-series", "thesis", "manuscript", "art-container",
                "art", "web-standalone", "web-contained", "conference-talk", "news"), names);
    }

    @Test
    void classify_isStableAcrossCalls() {
        Entry article = child(EntryType.ARTICLE, EntryType.PERIODICAL);
        assertEquals(EntryTypeClassifier.classify(article), EntryTypeClassifier.classify(article));
    }

    @Test
    void sourceType_rejectsOutOfBoundsParentIndex() {
        Entry orphan = child(EntryType.ARTICLE);
        assertThrows(IllegalStateException.class, () -> SourceType.of(PERIODICAL_ITEM, orphan, 0));
        assertThrows(IllegalStateException.class, () -> new SourceType(WEB_ITEM, 2).parent(orphan));
    }

    @Test
    void sourceType_parentPresenceMustMatchShape() {
        assertThrows(IllegalArgumentException.class, () -> new SourceType(GENERIC, 0));
        assertThrows(IllegalArgumentException.class, () -> SourceType.of(PERIODICAL_ITEM));
    }

    @Test
    void modality_matches() {
        assertTrue(Modality.any().matches(EntryType.AUDIO));
        assertTrue(Modality.specific(EntryType.BOOK).matches(EntryType.BOOK));
        assertFalse(Modality.specific(EntryType.BOOK).matches(EntryType.ANTHOLOGY));
        Modality web = Modality.alternate(EntryType.MISC, EntryType.BLOG);
        assertTrue(web.matches(EntryType.BLOG));
        assertFalse(web.matches(EntryType.WEB_ITEM));
    }
}
