package dev.dimitra.reviewbot.consolidation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.dimitra.reviewbot.model.ConsolidatedResult;
import dev.dimitra.reviewbot.model.Finding;
import dev.dimitra.reviewbot.model.ReviewCategory;
import dev.dimitra.reviewbot.model.ReviewComment;
import dev.dimitra.reviewbot.model.Severity;

import java.util.List;
import java.util.Map;

/**
 * JSON output for a finished review: the full report, and the comment list on its own.
 */
public class ConsolidatedReportWriter {

    private final ObjectMapper mapper;
    private final ObjectWriter pretty;

    public ConsolidatedReportWriter() {
        this(new ObjectMapper());
    }

    public ConsolidatedReportWriter(ObjectMapper mapper) {
        this.mapper = mapper;
        this.pretty = mapper.writerWithDefaultPrettyPrinter();
    }

    public ObjectNode toTree(ConsolidatedResult result) {
        ObjectNode root = mapper.createObjectNode();
        root.put("overall_score", result.overallScore());
        root.put("summary", result.summary());
        root.set("agent_reviews", mapper.valueToTree(result.reviewerResults()));
        root.set("critical_issues", mapper.valueToTree(result.criticalIssues()));

        ArrayNode recs = root.putArray("high_priority_recommendations");
        result.highPriorityRecommendations().forEach(recs::add);

        ObjectNode byCategory = root.putObject("findings_by_category");
        for (Map.Entry<ReviewCategory, List<Finding>> e : result.findingsByCategory().entrySet()) {
            byCategory.set(e.getKey().key(), mapper.valueToTree(e.getValue()));
        }

        ObjectNode distribution = root.putObject("severity_distribution");
        for (Map.Entry<Severity, Integer> e : result.severityDistribution().entrySet()) {
            distribution.put(e.getKey().value(), e.getValue());
        }

        root.put("detailed_analysis", result.detailedAnalysis());
        return root;
    }

    public String toJson(ConsolidatedResult result) throws JsonProcessingException {
        return pretty.writeValueAsString(toTree(result));
    }

    public String commentsToJson(List<ReviewComment> comments) throws JsonProcessingException {
        return pretty.writeValueAsString(comments);
    }

    public List<ReviewComment> commentsFromJson(String json) throws JsonProcessingException {
        return mapper.readValue(json, new TypeReference<List<ReviewComment>>() {});
    }
}
