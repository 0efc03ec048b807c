package dev.dimitra.reviewbot.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * The structured review one reviewer produced for one payload.
 */
@JsonPropertyOrder({"agent_name", "agent_type", "overall_score", "summary", "findings", "recommendations"})
public record ReviewerResult(
        @JsonProperty("agent_name") String reviewerName,
        @JsonProperty("agent_type") ReviewCategory category,
        @JsonProperty("overall_score") int score,
        String summary,
        List<Finding> findings,
        List<String> recommendations
) {
    public ReviewerResult {
        Objects.requireNonNull(reviewerName, "reviewerName");
        Objects.requireNonNull(category, "category");
        if (score < 1 || score > 10) {
            throw new IllegalArgumentException("score must be within [1,10]: " + score);
        }
        summary = summary == null ? "" : summary;
        findings = findings == null ? List.of() : List.copyOf(findings);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
