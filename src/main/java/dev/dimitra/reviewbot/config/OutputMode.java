package dev.dimitra.reviewbot.config;

import java.util.Locale;

/** What the command line prints once a review is done. */
public enum OutputMode {
    /** Pull-request markdown. */
    MARKDOWN,
    /** The comment array only. */
    JSON,
    /** The full consolidated report. */
    REPORT;

    public static OutputMode fromValue(String value) {
        if (value == null || value.isBlank()) return MARKDOWN;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("REVIEW_OUTPUT must be markdown, json or report: " + value, e);
        }
    }
}
