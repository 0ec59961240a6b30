package com.apareferences;

/**
 * Roles a person can hold on a record besides author and editor.
 */
public enum PersonRole {
    TRANSLATOR,
    AFTERWORD,
    FOREWORD,
    INTRODUCTION,
    ANNOTATOR,
    COMMENTATOR,
    HOLDER,
    COMPILER,
    FOUNDER,
    COLLABORATOR,
    ORGANIZER,
    CAST_MEMBER,
    COMPOSER,
    PRODUCER,
    EXECUTIVE_PRODUCER,
    WRITER,
    CINEMATOGRAPHY,
    DIRECTOR,
    ILLUSTRATOR,
    NARRATOR
}
