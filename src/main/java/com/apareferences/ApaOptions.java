package com.apareferences;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Tunable constants of the reference style.
 *
 * @param maxListedNames name lists longer than this are truncated with an ellipsis
 * @param noDateLabel    text shown in parentheses for undated records
 */
public record ApaOptions(int maxListedNames, String noDateLabel) {

    private static final Logger log = LoggerFactory.getLogger(ApaOptions.class);

    public static final String RESOURCE = "/apa-references.properties";

    // Property keys
    public static final String KEY_MAX_LISTED_NAMES = "apa.names.max-listed";
    public static final String KEY_NO_DATE_LABEL = "apa.date.no-date-label";

    public static final int DEFAULT_MAX_LISTED_NAMES = 20;
    public static final String DEFAULT_NO_DATE_LABEL = "n. d.";

    public static final ApaOptions DEFAULTS = new ApaOptions(DEFAULT_MAX_LISTED_NAMES, DEFAULT_NO_DATE_LABEL);

    public ApaOptions {
        if (maxListedNames < 2) {
            throw new IllegalArgumentException("maxListedNames must be at least 2, got " + maxListedNames);
        }
        if (noDateLabel == null || noDateLabel.isBlank()) {
            throw new IllegalArgumentException("noDateLabel must not be blank");
        }
    }

    /**
     * Options from {@value #RESOURCE} on the classpath, or {@link #DEFAULTS} when it is missing.
     */
    public static ApaOptions load() {
        try (InputStream in = ApaOptions.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", RESOURCE);
                return DEFAULTS;
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + RESOURCE, e);
        }
    }

    /**
     * Reads the known keys; missing or invalid values fall back to the defaults.
     */
    public static ApaOptions fromProperties(Properties props) {
        int maxNames = DEFAULT_MAX_LISTED_NAMES;
        String rawMax = props.getProperty(KEY_MAX_LISTED_NAMES);
        if (rawMax != null) {
            try {
                maxNames = Integer.parseInt(rawMax.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric {}={}", KEY_MAX_LISTED_NAMES, rawMax);
            }
            if (maxNames < 2) {
                log.warn("Ignoring {}={}, must be at least 2", KEY_MAX_LISTED_NAMES, rawMax);
                maxNames = DEFAULT_MAX_LISTED_NAMES;
            }
        }

        String label = props.getProperty(KEY_NO_DATE_LABEL, DEFAULT_NO_DATE_LABEL).trim();
        if (label.isEmpty()) {
            label = DEFAULT_NO_DATE_LABEL;
        }

        ApaOptions options = new ApaOptions(maxNames, label);
        log.debug("Loaded {}", options);
        return options;
    }
}
