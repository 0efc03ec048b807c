package dev.dimitra.reviewbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of reviewer perspectives.
 */
public enum ReviewCategory {
    SECURITY("security"),
    PERFORMANCE("performance"),
    CODING_PRACTICES("coding_practices"),
    ARCHITECTURE("architecture"),
    READABILITY("readability"),
    TESTABILITY("testability");

    private final String key;

    ReviewCategory(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /** "coding_practices" becomes "Coding Practices". */
    public String displayName() {
        StringBuilder sb = new StringBuilder();
        for (String word : key.split("_")) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }

    public static Optional<ReviewCategory> fromKey(String value) {
        if (value == null) return Optional.empty();
        String k = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if (k.equals("style")) return Optional.of(CODING_PRACTICES);
        return Arrays.stream(values()).filter(c -> c.key.equals(k)).findFirst();
    }
}
