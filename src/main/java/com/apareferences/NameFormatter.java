package com.apareferences;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders persons as {@code "van de Graf, J."} and lists of them as ampersand lists.
 */
public final class NameFormatter {

    private final ApaOptions options;

    public NameFormatter() {
        this(ApaOptions.DEFAULTS);
    }

    public NameFormatter(ApaOptions options) {
        this.options = options;
    }

    /**
     * {@code "{prefix }{name}, {initials}, {suffix}"}, leaving out whatever is absent.
     */
    public String renderName(Person person) {
        StringBuilder sb = new StringBuilder();
        person.prefixOpt().ifPresent(p -> sb.append(p).append(' '));
        sb.append(person.name());
        person.initials(".").ifPresent(i -> sb.append(", ").append(i));
        person.suffixOpt().ifPresent(s -> sb.append(", ").append(s));
        return sb.toString();
    }

    public List<String> renderNames(List<Person> persons) {
        List<String> names = new ArrayList<>(persons.size());
        for (Person p : persons) {
            names.add(renderName(p));
        }
        return names;
    }

    /**
     * Joins the rendered names with {@code ", "}, writing {@code "& "} before the last one.
     *
     * <p>Lists longer than {@link ApaOptions#maxListedNames()} keep the leading names up to one
     * less than that limit, then {@code "... "} and the final name, with no ampersand.
     */
    public String renderNameList(List<Person> persons) {
        return ampersandList(renderNames(persons));
    }

    String ampersandList(List<String> names) {
        int n = names.size();
        int max = options.maxListedNames();
        StringBuilder sb = new StringBuilder();

        if (n > max) {
            for (int i = 0; i < max - 1; i++) {
                sb.append(names.get(i)).append(", ");
            }
            return sb.append("... ").append(names.get(n - 1)).toString();
        }

        for (int i = 0; i < n; i++) {
            sb.append(names.get(i));
            if (i <= n - 2) sb.append(", ");
            if (i == n - 2) sb.append("& ");
        }
        return sb.toString();
    }
}
