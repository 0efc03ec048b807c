package dev.dimitra.reviewbot.consolidation;

import dev.dimitra.reviewbot.llm.BackendKind;
import dev.dimitra.reviewbot.llm.LlmClient;
import dev.dimitra.reviewbot.llm.LlmClientCache;
import dev.dimitra.reviewbot.model.ConsolidatedResult;
import dev.dimitra.reviewbot.model.Finding;
import dev.dimitra.reviewbot.model.ReviewCategory;
import dev.dimitra.reviewbot.model.ReviewComment;
import dev.dimitra.reviewbot.model.ReviewerResult;
import dev.dimitra.reviewbot.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Merges reviewer results into one {@link ConsolidatedResult} and renders it as line-anchored comments.
 * Backend trouble degrades the output (placeholder narrative, empty comment list) and is never thrown.
 */
public class ConsolidationEngine {
    private static final Logger log = LoggerFactory.getLogger(ConsolidationEngine.class);

    public static final int DEFAULT_SCORE = 5;
    public static final String ANALYSIS_UNAVAILABLE =
            "Unable to generate detailed analysis due to AI service unavailability.";

    static final int PAYLOAD_EXCERPT_CHARS = 1000;
    static final int NARRATIVE_FINDINGS = 10;
    static final int MAX_PRIORITY_RECOMMENDATIONS = 10;
    static final int NARRATIVE_MAX_TOKENS = 3000;
    static final int COMMENTS_MAX_TOKENS = 4000;
    static final double COMMENTS_TEMPERATURE = 0.2;

    static final List<String> PRIORITY_KEYWORDS = List.of(
            "security", "vulnerability", "critical", "fix immediately",
            "performance", "bottleneck", "memory leak", "sql injection",
            "xss", "authentication", "authorization");

    private static final String CONSOLIDATOR_ROLE =
            "You are a senior technical lead specializing in consolidating multiple code review reports.";

    private final LlmClient llm;
    private final double temperature;
    private final int maxRetries;
    private final ReviewCommentParser commentParser;
    private final FilePathNormalizer pathNormalizer;

    public ConsolidationEngine(LlmClient llm, double temperature, int maxRetries) {
        this(llm, temperature, maxRetries, new ReviewCommentParser(), new FilePathNormalizer());
    }

    public ConsolidationEngine(LlmClient llm,
                               double temperature,
                               int maxRetries,
                               ReviewCommentParser commentParser,
                               FilePathNormalizer pathNormalizer) {
        this.llm = Objects.requireNonNull(llm, "llm");
        this.temperature = Math.min(1.0, Math.max(0.0, temperature));
        this.maxRetries = Math.max(1, maxRetries);
        this.commentParser = Objects.requireNonNull(commentParser, "commentParser");
        this.pathNormalizer = Objects.requireNonNull(pathNormalizer, "pathNormalizer");
    }

    /** Consolidation runs slightly warmer than the reviewers: twice their creativity, capped at 1. */
    public static ConsolidationEngine create(LlmClientCache cache, BackendKind kind, double creativity, int maxRetries) {
        double t = Math.min(1.0, creativity * 2);
        return new ConsolidationEngine(cache.get("consolidation_agent", kind, t), t, maxRetries);
    }

    public ConsolidatedResult consolidate(List<ReviewerResult> reviews, String originalPayload) {
        List<ReviewerResult> results = reviews == null ? List.of() : List.copyOf(reviews);

        Map<String, Finding> distinct = new LinkedHashMap<>();
        List<String> recommendations = new ArrayList<>();
        for (ReviewerResult r : results) {
            for (Finding f : r.findings()) {
                distinct.putIfAbsent(f.dedupKey(), f);
            }
            recommendations.addAll(r.recommendations());
        }
        List<Finding> findings = List.copyOf(distinct.values());

        List<Finding> critical = new ArrayList<>();
        Map<ReviewCategory, List<Finding>> byCategory = new LinkedHashMap<>();
        Map<Severity, Integer> distribution = new EnumMap<>(Severity.class);
        for (Finding f : findings) {
            if (f.severity() == Severity.CRITICAL) critical.add(f);
            byCategory.computeIfAbsent(f.category(), k -> new ArrayList<>()).add(f);
            distribution.merge(f.severity(), 1, Integer::sum);
        }

        int score = overallScore(results);
        String narrative = detailedAnalysis(results, findings, originalPayload);

        return new ConsolidatedResult(
                score,
                executiveSummary(results, score, critical.size()),
                results,
                critical,
                highPriorityRecommendations(recommendations, critical),
                byCategory,
                distribution,
                narrative);
    }

    /**
     * Mean of the reviewer scores rounded half to even, clamped to [1,10]; {@link #DEFAULT_SCORE} with no reviewers.
     */
    public static int overallScore(List<ReviewerResult> results) {
        if (results.isEmpty()) return DEFAULT_SCORE;
        double mean = results.stream().mapToInt(ReviewerResult::score).average().orElse(DEFAULT_SCORE);
        return (int) Math.max(1, Math.min(10, Math.rint(mean)));
    }

    static String qualityBand(int score) {
        if (score >= 8) return "excellent";
        if (score >= 6) return "good";
        if (score >= 4) return "acceptable";
        return "needs improvement";
    }

    static String executiveSummary(List<ReviewerResult> results, int score, int criticalCount) {
        String names = results.stream()
                .map(r -> r.category().displayName())
                .collect(Collectors.joining(", "));
        StringBuilder sb = new StringBuilder();
        sb.append("Code review completed by ").append(results.size()).append(" specialized reviewer")
                .append(results.size() == 1 ? "" : "s");
        if (!names.isEmpty()) sb.append(": ").append(names);
        sb.append(".\nOverall code quality is ").append(qualityBand(score))
                .append(" with a score of ").append(score).append("/10.");
        if (criticalCount > 0) {
            sb.append(" However, ").append(criticalCount).append(" critical issue")
                    .append(criticalCount == 1 ? " requires" : "s require").append(" immediate attention.");
        }
        if (!names.isEmpty()) {
            sb.append("\nReview covers ").append(names.toLowerCase(Locale.ROOT)).append(" aspects.");
        }
        return sb.toString();
    }

    static List<String> highPriorityRecommendations(List<String> recommendations, List<Finding> critical) {
        Set<String> out = new LinkedHashSet<>();
        for (Finding f : critical) {
            if (f.suggestion() != null && !f.suggestion().isBlank()) {
                out.add("CRITICAL: " + f.suggestion());
            }
        }
        for (String rec : recommendations) {
            String lower = rec.toLowerCase(Locale.ROOT);
            if (PRIORITY_KEYWORDS.stream().anyMatch(lower::contains)) {
                out.add(rec);
            }
        }
        return out.stream().limit(MAX_PRIORITY_RECOMMENDATIONS).collect(Collectors.toList());
    }

    private String detailedAnalysis(List<ReviewerResult> results, List<Finding> findings, String payload) {
        if (results.isEmpty()) return ANALYSIS_UNAVAILABLE;
        String prompt = narrativePrompt(results, findings, payload);
        try {
            String text = llm.complete(CONSOLIDATOR_ROLE + " Provide comprehensive analysis and actionable recommendations.",
                    prompt, temperature, NARRATIVE_MAX_TOKENS).text();
            if (text != null && !text.isBlank()) return text;
            log.error("Consolidation narrative came back empty");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while generating the consolidation narrative");
        } catch (IOException | RuntimeException e) {
            log.error("Consolidation narrative failed: {}", e.getMessage());
        }
        return ANALYSIS_UNAVAILABLE;
    }

    static String narrativePrompt(List<ReviewerResult> results, List<Finding> findings, String payload) {
        String code = payload == null ? "" : payload;
        String excerpt = code.length() > PAYLOAD_EXCERPT_CHARS ? code.substring(0, PAYLOAD_EXCERPT_CHARS) + "..." : code;

        StringBuilder sb = new StringBuilder();
        sb.append("You are a senior technical lead consolidating multiple specialized code review reports.\n\n");
        sb.append("Original Code:\n```\n").append(excerpt).append("\n```\n\n");
        sb.append("Reviewer Summary:\n");
        for (ReviewerResult r : results) {
            sb.append("- ").append(r.reviewerName()).append(": Score ").append(r.score()).append("/10, ")
                    .append(r.findings().isEmpty() ? "no major issues" : r.findings().size() + " findings").append('\n');
        }
        sb.append("\nKey Findings:\n");
        findings.stream().limit(NARRATIVE_FINDINGS).forEach(f ->
                sb.append("- [").append(f.severity().name()).append("] ").append(f.title()).append('\n'));
        sb.append("""

                Provide a consolidated analysis that covers:
                1. Cross-reviewer correlation: patterns and connections between findings
                2. Priority assessment: rank issues by business impact and technical risk
                3. Root cause analysis: underlying causes behind several issues
                4. Implementation roadmap: the order in which to address issues
                5. Trade-offs: conflicts between recommendations
                6. Quality gates: what must be fixed before the code can be deployed

                Be specific and actionable.""");
        return sb.toString();
    }

    public List<ReviewComment> generateReviewComments(ConsolidatedResult result,
                                                      String primaryFilePath,
                                                      List<String> knownFilePaths) {
        return generate(result, primaryFilePath, knownFilePaths).comments();
    }

    /**
     * Like {@link #generateReviewComments} but also reports whether the list is a fallback.
     */
    public CommentBatch generate(ConsolidatedResult result, String primaryFilePath, List<String> knownFilePaths) {
        List<String> known = knownFilePaths == null ? List.of() : List.copyOf(knownFilePaths);
        String system = CONSOLIDATOR_ROLE + "\n" + REVIEW_GOAL + "\n" + OUTPUT_FORMAT;
        String prompt = commentPrompt(result, primaryFilePath, known);

        String reply = null;
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                String text = llm.complete(system, prompt, COMMENTS_TEMPERATURE, COMMENTS_MAX_TOKENS).text();
                if (text != null && !text.isBlank()) {
                    reply = text;
                    break;
                }
                log.warn("Comment generation attempt {}/{} returned an empty reply", attempt, maxRetries);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Comment generation interrupted on attempt {}", attempt);
                break;
            } catch (IOException | RuntimeException e) {
                log.warn("Comment generation attempt {}/{} failed: {}", attempt, maxRetries, e.getMessage());
            }
        }
        if (reply == null) {
            log.error("All {} comment generation attempt(s) failed", maxRetries);
            return new CommentBatch(List.of(), true);
        }

        var parsed = commentParser.tryParse(reply);
        if (parsed.isEmpty()) {
            log.error("Comment generation reply was not a JSON array; returning no comments");
            return new CommentBatch(List.of(), true);
        }
        // once on the claimed paths, so round-robin cannot split a repeated issue across files,
        // and once more after normalization has merged claimed and assigned paths
        List<ReviewComment> distinct = dedupe(parsed.get());
        List<ReviewComment> normalized = pathNormalizer.normalize(distinct, primaryFilePath, known);
        return new CommentBatch(dedupe(normalized), false);
    }

    /** Keeps the first of any comments sharing file (missing or unknown count as one file), line and normalized text. */
    static List<ReviewComment> dedupe(List<ReviewComment> comments) {
        Map<String, ReviewComment> seen = new LinkedHashMap<>();
        for (ReviewComment c : comments) {
            String path = c.filePath() == null ? "" : c.filePath().trim();
            if ("unknown".equalsIgnoreCase(path)) path = "";
            String key = path + "#" + c.lineNumber() + "#"
                    + c.reviewComment().toLowerCase(Locale.ROOT).replaceAll("\\W+", " ").trim();
            seen.putIfAbsent(key, c);
        }
        return List.copyOf(seen.values());
    }

    static String commentPrompt(ConsolidatedResult result, String primaryFilePath, List<String> known) {
        StringBuilder sb = new StringBuilder();
        sb.append(REVIEW_GOAL).append('\n').append(OUTPUT_FORMAT).append("\nReviewer Reports to Consolidate:\n");
        for (ReviewerResult r : result.reviewerResults()) {
            sb.append("\n**").append(r.category().displayName()).append(" Review:**\n").append(r.summary()).append('\n');
            sb.append("\n**Recommendations:**\n");
            for (String rec : r.recommendations()) {
                sb.append("- ").append(rec).append('\n');
            }
        }
        if (!known.isEmpty()) {
            sb.append("\nFiles in this diff: ").append(String.join(", ", known)).append('\n');
        } else {
            sb.append("\nFile being reviewed: ").append(primaryFilePath).append('\n');
        }
        sb.append("""

                CONSOLIDATION INSTRUCTIONS:
                1. Analyze ALL reviewer feedback; do not drop any distinct issue mentioned by any reviewer
                2. Deduplicate: when several reviewers report the same issue on the same or nearby lines, merge them into ONE comment
                3. Combine related issues (for example input validation and parameter validation) into one comment
                4. Extract specific line numbers where mentioned
                5. Every review_comment must be complete and actionable, with a concrete fix
                6. Never use placeholder text and never truncate a comment

                Return the JSON array only: no duplicate issue for the same line, and every distinct issue included.""");
        return sb.toString();
    }

    private static final String REVIEW_GOAL = """
            Goal:
            Review each hunk of the diff together with the reviewer feedback.
            - If there is feedback for a hunk: give crisp feedback with line numbers and the change to make.
            - If there is no feedback for a hunk: skip it.
            - Keep comments short so the review is not overwhelming.
            """;

    private static final String OUTPUT_FORMAT = """
            CRITICAL: Your response must be ONLY a valid JSON array, with no other text or markdown.
            [
                {
                    "file_path": "filename.js",
                    "line_number": 10,
                    "review_comment": "Specific issue description and suggested fix"
                }
            ]
            If no issues are found, return: []
            """;

    /** Comment list plus a flag telling whether it is the empty fallback after a failure. */
    public record CommentBatch(List<ReviewComment> comments, boolean degraded) {
        public CommentBatch {
            comments = List.copyOf(comments);
        }
    }
}
