package com.apareferences;

/**
 * A person credited on a record in a role other than author or editor.
 */
public record Affiliation(Person person, PersonRole role) {
}
