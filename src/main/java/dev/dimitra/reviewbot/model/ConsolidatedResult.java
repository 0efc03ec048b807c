package dev.dimitra.reviewbot.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merged outcome of one review cycle. Built once by the consolidation engine, read-only afterwards.
 * Serialized by {@code ConsolidatedReportWriter}.
 */
public record ConsolidatedResult(
        int overallScore,
        String summary,
        List<ReviewerResult> reviewerResults,
        List<Finding> criticalIssues,
        List<String> highPriorityRecommendations,
        Map<ReviewCategory, List<Finding>> findingsByCategory,
        Map<Severity, Integer> severityDistribution,
        String detailedAnalysis
) {
    public ConsolidatedResult {
        reviewerResults = List.copyOf(reviewerResults);
        criticalIssues = List.copyOf(criticalIssues);
        highPriorityRecommendations = List.copyOf(highPriorityRecommendations);

        Map<ReviewCategory, List<Finding>> byCategory = new LinkedHashMap<>();
        findingsByCategory.forEach((k, v) -> byCategory.put(k, List.copyOf(v)));
        findingsByCategory = Collections.unmodifiableMap(byCategory);

        Map<Severity, Integer> distribution = new EnumMap<>(Severity.class);
        distribution.putAll(severityDistribution);
        severityDistribution = Collections.unmodifiableMap(distribution);
    }

    public boolean hasCriticalIssues() {
        return !criticalIssues.isEmpty();
    }
}
