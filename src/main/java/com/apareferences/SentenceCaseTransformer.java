package com.apareferences;

/**
 * Converts a title to sentence case.
 */
@FunctionalInterface
public interface SentenceCaseTransformer {

    String apply(String title);
}
