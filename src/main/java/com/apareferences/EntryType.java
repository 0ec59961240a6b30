package com.apareferences;

/**
 * Closed set of bibliographic record kinds.
 */
public enum EntryType {
    ARTICLE,
    CHAPTER,
    ENTRY,
    ANTHOS,
    REPORT,
    THESIS,
    WEB_ITEM,
    SCENE,
    ARTWORK,
    PATENT,
    CASE,
    NEWSPAPER_ISSUE,
    LEGISLATION,
    MANUSCRIPT,
    TWEET,
    MISC,
    PERIODICAL,
    PROCEEDINGS,
    BOOK,
    BLOG,
    REFERENCE,
    CONFERENCE,
    ANTHOLOGY,
    IN_ANTHOLOGY,
    REPOSITORY,
    THREAD,
    VIDEO,
    AUDIO,
    EXHIBITION
}
