package dev.dimitra.reviewbot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Locale;
import java.util.Objects;

/**
 * One issue reported by a reviewer. Two findings are the same issue when {@link #dedupKey()} matches.
 */
@JsonPropertyOrder({"agent_type", "severity", "title", "description", "line_number", "code_snippet", "suggestion", "category"})
public record Finding(
        @JsonProperty("agent_type") ReviewCategory category,
        Severity severity,
        String title,
        String description,
        @JsonProperty("line_number") Integer lineNumber,
        @JsonProperty("code_snippet") String codeSnippet,
        String suggestion
) {
    public Finding {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(severity, "severity");
        title = title == null ? "" : title;
        description = description == null ? title : description;
    }

    /** Same value as agent_type; kept on the wire for report consumers. */
    @JsonProperty("category")
    public String categoryKey() {
        return category.key();
    }

    @JsonIgnore
    public String dedupKey() {
        return category.key() + "#" + (lineNumber == null ? "-" : lineNumber) + "#" + normalize(title);
    }

    static String normalize(String title) {
        return title.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9 ]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }
}
