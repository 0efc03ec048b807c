package dev.dimitra.reviewbot.analysis;

import dev.dimitra.reviewbot.model.Finding;
import dev.dimitra.reviewbot.model.ReviewCategory;
import dev.dimitra.reviewbot.model.ReviewerResult;
import dev.dimitra.reviewbot.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a reviewer's free-form reply into a {@link ReviewerResult} by keyword scanning.
 * <p>
 * Keyword table (case-insensitive substring match, first row that matches wins):
 * <pre>
 *   critical | severe | vulnerability   -> CRITICAL
 *   high | important | major            -> HIGH
 *   medium | moderate                   -> MEDIUM
 *   low | minor                         -> LOW
 *   (anything else)                     -> INFO
 * </pre>
 * A line is a finding when it contains one of {@link #FINDING_MARKERS}, and a recommendation when it contains
 * one of {@link #RECOMMENDATION_MARKERS}. A line can be both.
 */
public class ResponseParser {

    static final Map<Severity, List<String>> SEVERITY_KEYWORDS = new LinkedHashMap<>();
    static {
        SEVERITY_KEYWORDS.put(Severity.CRITICAL, List.of("critical", "severe", "vulnerability"));
        SEVERITY_KEYWORDS.put(Severity.HIGH, List.of("high", "important", "major"));
        SEVERITY_KEYWORDS.put(Severity.MEDIUM, List.of("medium", "moderate"));
        SEVERITY_KEYWORDS.put(Severity.LOW, List.of("low", "minor"));
    }

    static final List<String> FINDING_MARKERS = List.of("issue:", "problem:", "vulnerability:", "warning:");
    static final List<String> RECOMMENDATION_MARKERS = List.of("recommend:", "suggest:", "should:", "fix:");

    static final int SUMMARY_LIMIT = 200;

    private static final Pattern LINE_REF = Pattern.compile("line\\s*(\\d+)", Pattern.CASE_INSENSITIVE);

    public ReviewerResult parse(ReviewCategory category, String reviewerName, String response) {
        String text = response == null ? "" : response;
        List<Finding> findings = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        for (String raw : text.split("\n")) {
            String line = raw.strip();
            if (line.isEmpty()) continue;
            String lower = line.toLowerCase(Locale.ROOT);

            boolean isRecommendation = containsAny(lower, RECOMMENDATION_MARKERS);
            if (containsAny(lower, FINDING_MARKERS)) {
                findings.add(new Finding(
                        category,
                        classify(lower),
                        line,
                        line,
                        lineNumber(line),
                        null,
                        isRecommendation ? suggestionOf(line, lower) : null));
            }
            if (isRecommendation) {
                recommendations.add(line);
            }
        }

        return new ReviewerResult(reviewerName, category, score(findings), summarize(text), findings, recommendations);
    }

    public static Severity classify(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (Map.Entry<Severity, List<String>> e : SEVERITY_KEYWORDS.entrySet()) {
            if (containsAny(lower, e.getValue())) return e.getKey();
        }
        return Severity.INFO;
    }

    /** 10 minus 3/2/1 per critical/high/medium finding, never below 1. */
    public static int score(List<Finding> findings) {
        int score = 10;
        for (Finding f : findings) {
            score -= f.severity().scorePenalty();
        }
        return Math.max(1, score);
    }

    static Integer lineNumber(String line) {
        Matcher m = LINE_REF.matcher(line);
        if (!m.find()) return null;
        try {
            return Integer.valueOf(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String summarize(String response) {
        return response.length() > SUMMARY_LIMIT ? response.substring(0, SUMMARY_LIMIT) + "..." : response;
    }

    private static String suggestionOf(String line, String lower) {
        for (String marker : RECOMMENDATION_MARKERS) {
            int idx = lower.indexOf(marker);
            if (idx >= 0) {
                String tail = line.substring(idx + marker.length()).strip();
                return tail.isEmpty() ? null : tail;
            }
        }
        return null;
    }

    private static boolean containsAny(String lower, List<String> needles) {
        for (String n : needles) {
            if (lower.contains(n)) return true;
        }
        return false;
    }
}
