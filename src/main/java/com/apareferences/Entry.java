package com.apareferences;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * An immutable bibliographic record.
 *
 * <p>Every field except the type is optional; accessors report absence through {@link Optional}.
 * Parents form the containment chain (an article's journal, a chapter's anthology) and are
 * referenced, not owned.
 */
public final class Entry {

    private final String key;
    private final EntryType type;
    private final List<Entry> parents;
    private final String title;
    private final List<Person> authors;
    private final List<Person> editors;
    private final List<Affiliation> affiliated;
    private final EntryDate date;
    private final NumberRange volume;
    private final String issue;
    private final Edition edition;
    private final NumberRange pageRange;
    private final String serialNumber;
    private final QualifiedUrl url;
    private final String publisher;
    private final String organization;
    private final String archive;

    private Entry(Builder b) {
        this.key = b.key;
        this.type = Objects.requireNonNull(b.type, "type");
        this.parents = List.copyOf(b.parents);
        this.title = b.title;
        this.authors = List.copyOf(b.authors);
        this.editors = List.copyOf(b.editors);
        this.affiliated = List.copyOf(b.affiliated);
        this.date = b.date;
        this.volume = b.volume;
        this.issue = b.issue;
        this.edition = b.edition;
        this.pageRange = b.pageRange;
        this.serialNumber = b.serialNumber;
        this.url = b.url;
        this.publisher = b.publisher;
        this.organization = b.organization;
        this.archive = b.archive;
    }

    public static Builder builder(EntryType type) {
        return new Builder(type);
    }

    public Optional<String> key() {
        return Optional.ofNullable(key);
    }

    public EntryType type() {
        return type;
    }

    public List<Entry> parents() {
        return parents;
    }

    public Optional<String> title() {
        return Optional.ofNullable(title);
    }

    /**
     * The title passed through {@code transformer}, e.g. a sentence-case transform.
     */
    public Optional<String> title(SentenceCaseTransformer transformer) {
        return title().map(transformer::apply);
    }

    public List<Person> authors() {
        return authors;
    }

    public List<Person> editors() {
        return editors;
    }

    public List<Affiliation> affiliated() {
        return affiliated;
    }

    /**
     * Persons credited with {@code role}, in record order.
     */
    public List<Person> affiliated(PersonRole role) {
        List<Person> out = new ArrayList<>();
        for (Affiliation a : affiliated) {
            if (a.role() == role) out.add(a.person());
        }
        return out;
    }

    public Optional<EntryDate> date() {
        return Optional.ofNullable(date);
    }

    public Optional<NumberRange> volume() {
        return Optional.ofNullable(volume);
    }

    public Optional<String> issue() {
        return Optional.ofNullable(issue);
    }

    public Optional<Edition> edition() {
        return Optional.ofNullable(edition);
    }

    public Optional<NumberRange> pageRange() {
        return Optional.ofNullable(pageRange);
    }

    public Optional<String> serialNumber() {
        return Optional.ofNullable(serialNumber);
    }

    public Optional<QualifiedUrl> url() {
        return Optional.ofNullable(url);
    }

    public Optional<String> publisher() {
        return Optional.ofNullable(publisher);
    }

    public Optional<String> organization() {
        return Optional.ofNullable(organization);
    }

    public Optional<String> archive() {
        return Optional.ofNullable(archive);
    }

    /**
     * Publisher if present, otherwise organization.
     */
    public Optional<String> publisherOrOrganization() {
        return publisher().or(this::organization);
    }

    /**
     * Index of the first parent whose type satisfies {@code modality}.
     */
    public OptionalInt findParent(Modality modality) {
        for (int i = 0; i < parents.size(); i++) {
            if (modality.matches(parents.get(i).type())) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    @Override
    public String toString() {
        return "Entry[" + type + (key == null ? "" : ", " + key) + "]";
    }

    public static final class Builder {
        private String key;
        private final EntryType type;
        private final List<Entry> parents = new ArrayList<>();
        private String title;
        private final List<Person> authors = new ArrayList<>();
        private final List<Person> editors = new ArrayList<>();
        private final List<Affiliation> affiliated = new ArrayList<>();
        private EntryDate date;
        private NumberRange volume;
        private String issue;
        private Edition edition;
        private NumberRange pageRange;
        private String serialNumber;
        private QualifiedUrl url;
        private String publisher;
        private String organization;
        private String archive;

        private Builder(EntryType type) {
            this.type = type;
        }

        public Builder key(String key) {
            this.key = emptyToNull(key);
            return this;
        }

        public Builder parent(Entry parent) {
            this.parents.add(Objects.requireNonNull(parent, "parent"));
            return this;
        }

        public Builder title(String title) {
            this.title = emptyToNull(title);
            return this;
        }

        public Builder author(Person author) {
            this.authors.add(Objects.requireNonNull(author, "author"));
            return this;
        }

        public Builder authors(List<Person> authors) {
            authors.forEach(this::author);
            return this;
        }

        public Builder editor(Person editor) {
            this.editors.add(Objects.requireNonNull(editor, "editor"));
            return this;
        }

        public Builder editors(List<Person> editors) {
            editors.forEach(this::editor);
            return this;
        }

        public Builder affiliated(Person person, PersonRole role) {
            this.affiliated.add(new Affiliation(person, role));
            return this;
        }

        public Builder date(EntryDate date) {
            this.date = date;
            return this;
        }

        public Builder volume(NumberRange volume) {
            this.volume = volume;
            return this;
        }

        public Builder volume(long volume) {
            return volume(NumberRange.single(volume));
        }

        public Builder issue(String issue) {
            this.issue = emptyToNull(issue);
            return this;
        }

        public Builder edition(Edition edition) {
            this.edition = edition;
            return this;
        }

        public Builder pageRange(NumberRange pageRange) {
            this.pageRange = pageRange;
            return this;
        }

        public Builder serialNumber(String serialNumber) {
            this.serialNumber = emptyToNull(serialNumber);
            return this;
        }

        public Builder url(QualifiedUrl url) {
            this.url = url;
            return this;
        }

        public Builder publisher(String publisher) {
            this.publisher = emptyToNull(publisher);
            return this;
        }

        public Builder organization(String organization) {
            this.organization = emptyToNull(organization);
            return this;
        }

        public Builder archive(String archive) {
            this.archive = emptyToNull(archive);
            return this;
        }

        public Entry build() {
            return new Entry(this);
        }

        private static String emptyToNull(String s) {
            return s == null || s.isBlank() ? null : s.trim();
        }
    }
}
