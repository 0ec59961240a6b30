package com.apareferences;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceFormatterJUnitTest {

    private final SourceFormatter formatter = new SourceFormatter();

    private static Entry journal(String title, Long volume, String issue) {
        Entry.Builder b = Entry.builder(EntryType.PERIODICAL).title(title).issue(issue);
        if (volume != null) b.volume(volume);
        return b.build();
    }

    private static Entry handbook() {
        return Entry.builder(EntryType.ANTHOLOGY)
                .title("Handbook of Memory")
                .editor(Person.of("Tulving", "Endel"))
                .publisher("Oxford University Press")
                .build();
    }

    @Test
    void periodicalItem_titleVolumeIssuePages() {
        Entry article = Entry.builder(EntryType.ARTICLE)
                .parent(journal("Journal of Applied Psychology", 12L, "3"))
                .pageRange(new NumberRange(45, 67))
                .build();

        assertEquals("Journal of applied psychology, 12(3), 45–67.", formatter.renderSource(article));
    }

    @Test
    void periodicalItem_serialNumberWinsOverPages() {
        Entry article = Entry.builder(EntryType.ARTICLE)
                .parent(journal("Nature", 12L, "3"))
                .serialNumber("e1001")
                .pageRange(new NumberRange(1, 9))
                .build();

        assertEquals("Nature, 12(3), e1001.", formatter.renderSource(article));
    }

    @Test
    void periodicalItem_partialClauses() {
        assertEquals("Nature.", formatter.renderSource(
                Entry.builder(EntryType.ARTICLE).parent(journal("Nature", null, null)).build()));
        assertEquals("(4), 10.", formatter.renderSource(Entry.builder(EntryType.ARTICLE)
                .parent(journal(null, null, "4")).pageRange(NumberRange.single(10)).build()));
        assertEquals("", formatter.renderSource(
                Entry.builder(EntryType.ARTICLE).parent(journal(null, null, null)).build()));
    }

    @Test
    void periodicalItem_fallsBackToEntryVolume() {
        Entry article = Entry.builder(EntryType.ARTICLE)
                .parent(journal("Nature", null, null))
                .volume(7)
                .build();

        assertEquals("Nature, 7.", formatter.renderSource(article));
    }

    @Test
    void periodicalItem_readsTheMatchedParentNotTheFirst() {
        Entry article = Entry.builder(EntryType.ARTICLE)
                .parent(Entry.builder(EntryType.BLOG).title("Wrong").build())
                .parent(journal("Right", null, null))
                .build();

        assertEquals("Right.", formatter.renderSource(article));
    }

    @Test
    void collectionItem_singleEditor() {
        Entry chapter = Entry.builder(EntryType.IN_ANTHOLOGY).parent(handbook()).build();
        assertEquals("In Tulving, E. (Ed.), Handbook of memory. Oxford University Press.", formatter.renderSource(chapter));
    }

    @Test
    void collectionItem_severalEditorsAndEdition() {
        Entry parent = Entry.builder(EntryType.ANTHOLOGY)
                .title("Handbook of Memory")
                .editor(Person.of("Tulving", "Endel"))
                .editor(Person.of("Craik", "Fergus I. M."))
                .edition(Edition.of(2))
                .organization("Memory Society")
                .build();
        Entry chapter = Entry.builder(EntryType.IN_ANTHOLOGY).parent(parent).build();

        assertEquals("In Tulving, E., & Craik, F. I. M. (Eds.), Handbook of memory (2nd ed.). Memory Society.",
                formatter.renderSource(chapter));
    }

    @Test
    void collectionItem_withoutEditorsOrPublisher() {
        Entry parent = Entry.builder(EntryType.PROCEEDINGS).title("Proceedings of the Workshop").build();
        Entry paper = Entry.builder(EntryType.ARTICLE).parent(parent).build();

        assertEquals("In Proceedings of the workshop.", formatter.renderSource(paper));
    }

    @Test
    void collectionItem_editorsWithoutTitle() {
        Entry parent = Entry.builder(EntryType.ANTHOLOGY).editor(Person.of("Tulving", "Endel")).build();
        Entry chapter = Entry.builder(EntryType.IN_ANTHOLOGY).parent(parent).build();

        assertEquals("In Tulving, E. (Ed.).", formatter.renderSource(chapter));
    }

    @Test
    void collectionItem_fallsBackToEntryEditors() {
        Entry parent = Entry.builder(EntryType.ANTHOLOGY).title("Readings").build();
        Entry chapter = Entry.builder(EntryType.IN_ANTHOLOGY)
                .parent(parent)
                .editor(Person.of("Doe", "Jane"))
                .build();

        assertEquals("In Doe, J. (Ed.), Readings.", formatter.renderSource(chapter));
    }

    @Test
    void tvSeries_usesExecutiveProducersOfSeries() {
        Entry series = Entry.builder(EntryType.VIDEO)
                .title("Breaking Bad")
                .affiliated(Person.of("Gilligan", "Vince"), PersonRole.EXECUTIVE_PRODUCER)
                .affiliated(Person.of("Cranston", "Bryan"), PersonRole.CAST_MEMBER)
                .publisher("AMC")
                .build();
        Entry episode = Entry.builder(EntryType.VIDEO).parent(series).issue("1").volume(1).build();

        assertEquals("In Gilligan, V. (Ed.), Breaking bad. AMC.", formatter.renderSource(episode));
    }

    @Test
    void tvSeries_fallsBackToEpisodeAuthors() {
        Entry series = Entry.builder(EntryType.VIDEO).title("Breaking Bad").build();
        Entry episode = Entry.builder(EntryType.VIDEO)
                .parent(series)
                .author(Person.of("Johnson", "Rian"))
                .issue("14")
                .volume(5)
                .build();

        assertEquals("In Johnson, R. (Ed.), Breaking bad.", formatter.renderSource(episode));
    }

    @Test
    void thesis_archiveThenOrganization() {
        assertEquals("ProQuest.", formatter.renderSource(
                Entry.builder(EntryType.THESIS).archive("ProQuest").organization("MIT").build()));
        assertEquals("MIT.", formatter.renderSource(Entry.builder(EntryType.THESIS).organization("MIT").build()));
        assertEquals("", formatter.renderSource(Entry.builder(EntryType.THESIS).build()));
    }

    @Test
    void manuscript_archiveOnly() {
        assertEquals("Bodleian Library.", formatter.renderSource(
                Entry.builder(EntryType.MANUSCRIPT).archive("Bodleian Library").build()));
        assertEquals("", formatter.renderSource(
                Entry.builder(EntryType.MANUSCRIPT).organization("Oxford").build()));
    }

    @Test
    void generic_publisherThenOrganization() {
        assertEquals("Addison-Wesley.", formatter.renderSource(
                Entry.builder(EntryType.BOOK).publisher("Addison-Wesley").organization("W3C").build()));
        assertEquals("W3C.", formatter.renderSource(Entry.builder(EntryType.REPORT).organization("W3C").build()));
        assertEquals("Acme Inc.", formatter.renderSource(Entry.builder(EntryType.BOOK).publisher("Acme Inc.").build()));
        assertEquals("", formatter.renderSource(Entry.builder(EntryType.BOOK).build()));
    }

    @Test
    void webItem_containerTitleAndPublisher() {
        Entry blog = Entry.builder(EntryType.BLOG).title("Science Blog").publisher("Scientific American").build();
        Entry post = Entry.builder(EntryType.ARTICLE).parent(blog).build();

        assertEquals("Science blog, Scientific American.", formatter.renderSource(post));
    }

    @Test
    void webItem_publisherFallsBackToEntry() {
        Entry blog = Entry.builder(EntryType.BLOG).title("Science Blog").build();
        Entry post = Entry.builder(EntryType.ARTICLE).parent(blog).organization("Blog Network").build();

        assertEquals("Science blog, Blog Network.", formatter.renderSource(post));
    }

    @Test
    void standaloneWebItemAndArt() {
        assertEquals("Wikimedia Foundation.", formatter.renderSource(
                Entry.builder(EntryType.WEB_ITEM).publisher("Wikimedia Foundation").build()));
        assertEquals("Museum of Modern Art.", formatter.renderSource(
                Entry.builder(EntryType.EXHIBITION).organization("Museum of Modern Art").build()));
        assertEquals("Louvre, Réunion des musées nationaux.", formatter.renderSource(
                Entry.builder(EntryType.ARTWORK).organization("Louvre").publisher("Réunion des musées nationaux").build()));
    }

    @Test
    void artContainer_inParentTitle() {
        Entry painting = Entry.builder(EntryType.ARTWORK).title("{Mona Lisa}").organization("Louvre").build();
        Entry detail = Entry.builder(EntryType.SCENE).parent(painting).build();

        assertEquals("In Mona Lisa, Louvre.", formatter.renderSource(detail));
    }

    @Test
    void conferenceTalk_titleAndOrganizer() {
        Entry conference = Entry.builder(EntryType.CONFERENCE)
                .title("Annual Meeting of the APA")
                .organization("American Psychological Association")
                .build();
        Entry talk = Entry.builder(EntryType.AUDIO).parent(conference).build();

        assertEquals("Annual meeting of the APA, American Psychological Association.", formatter.renderSource(talk));
    }

    @Test
    void newsItem_titleIssueAndPage() {
        Entry paper = Entry.builder(EntryType.NEWSPAPER_ISSUE).title("{The New York Times}").issue("58212").build();
        Entry article = Entry.builder(EntryType.ARTICLE).parent(paper).pageRange(NumberRange.single(1)).build();

        assertEquals("The New York Times, (58212), 1.", formatter.renderSource(article));
    }
}
