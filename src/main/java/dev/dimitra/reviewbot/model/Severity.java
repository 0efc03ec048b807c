package dev.dimitra.reviewbot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Ordered by decreasing urgency. */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromValue(String value) {
        if (value == null) return INFO;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return INFO;
        }
    }

    /** Points taken off a reviewer's score per finding of this severity. */
    public int scorePenalty() {
        switch (this) {
            case CRITICAL: return 3;
            case HIGH: return 2;
            case MEDIUM: return 1;
            default: return 0;
        }
    }
}
