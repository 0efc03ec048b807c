package dev.dimitra.reviewbot.consolidation;

import com.fasterxml.jackson.databind.JsonNode;
import dev.dimitra.reviewbot.model.ConsolidatedResult;
import dev.dimitra.reviewbot.model.Finding;
import dev.dimitra.reviewbot.model.ReviewCategory;
import dev.dimitra.reviewbot.model.ReviewComment;
import dev.dimitra.reviewbot.model.ReviewerResult;
import dev.dimitra.reviewbot.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConsolidatedReportWriterTest {

    private final ConsolidatedReportWriter writer = new ConsolidatedReportWriter();

    private static ConsolidatedResult sample() {
        Finding critical = new Finding(ReviewCategory.SECURITY, Severity.CRITICAL, "Hard-coded key", "Key in source",
                12, "String KEY = \"abc\";", "load it from the environment");
        ReviewerResult security = new ReviewerResult("SecurityReviewer", ReviewCategory.SECURITY, 7,
                "One critical issue.", List.of(critical), List.of("Recommend: rotate keys"));
        return new ConsolidatedResult(7, "summary text", List.of(security), List.of(critical),
                List.of("CRITICAL: load it from the environment"),
                Map.of(ReviewCategory.SECURITY, List.of(critical)),
                Map.of(Severity.CRITICAL, 1),
                "narrative");
    }

    @Test
    void reportUsesSnakeCaseKeys() {
        JsonNode tree = writer.toTree(sample());

        assertThat(tree.fieldNames()).toIterable().containsExactly(
                "overall_score", "summary", "agent_reviews", "critical_issues", "high_priority_recommendations",
                "findings_by_category", "severity_distribution", "detailed_analysis");
        assertThat(tree.path("findings_by_category").has("security")).isTrue();
        assertThat(tree.path("severity_distribution").path("critical").asInt()).isEqualTo(1);

        JsonNode review = tree.path("agent_reviews").path(0);
        assertThat(review.path("agent_name").asText()).isEqualTo("SecurityReviewer");
        assertThat(review.path("agent_type").asText()).isEqualTo("security");
        assertThat(review.path("overall_score").asInt()).isEqualTo(7);

        JsonNode issue = tree.path("critical_issues").path(0);
        assertThat(issue.path("severity").asText()).isEqualTo("critical");
        assertThat(issue.path("line_number").asInt()).isEqualTo(12);
        assertThat(issue.path("code_snippet").asText()).contains("KEY");
        assertThat(issue.has("dedupKey")).isFalse();
    }

    @Test
    void commentListRoundTripIsIdempotent() throws Exception {
        List<ReviewComment> comments = List.of(
                new ReviewComment("a.js", 3, "Use const: naïve reassignment check."),
                new ReviewComment("b.js", null, "File-level note"));

        String first = writer.commentsToJson(comments);
        String second = writer.commentsToJson(writer.commentsFromJson(first));

        assertThat(second).isEqualTo(first);
        assertThat(first).contains("\"line_number\" : null");
    }

    @Test
    void emptyCommentListIsEmptyArray() throws Exception {
        assertThat(writer.commentsToJson(List.of())).isEqualTo("[ ]");
    }
}
