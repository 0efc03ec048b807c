package dev.dimitra.reviewbot.review;

import dev.dimitra.reviewbot.config.ReviewSettings;
import dev.dimitra.reviewbot.consolidation.ConsolidationEngine;
import dev.dimitra.reviewbot.diff.DiffFileCollector;
import dev.dimitra.reviewbot.format.ReviewCommentFormatter;
import dev.dimitra.reviewbot.llm.LlmClientCache;
import dev.dimitra.reviewbot.model.ConsolidatedResult;
import dev.dimitra.reviewbot.model.ReviewerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * One entry point for a whole review cycle: dispatch reviewers, consolidate, render comments.
 */
public class MultiAgentReviewer {
    private static final Logger log = LoggerFactory.getLogger(MultiAgentReviewer.class);

    public static final String UNKNOWN_FILE = "unknown";

    private final ReviewOrchestrator orchestrator;
    private final ConsolidationEngine consolidation;
    private final ReviewCommentFormatter formatter;
    private final DiffFileCollector diffFiles;
    private final boolean parallel;

    public MultiAgentReviewer(ReviewOrchestrator orchestrator,
                              ConsolidationEngine consolidation,
                              ReviewCommentFormatter formatter,
                              DiffFileCollector diffFiles,
                              boolean parallel) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.consolidation = Objects.requireNonNull(consolidation, "consolidation");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.diffFiles = Objects.requireNonNull(diffFiles, "diffFiles");
        this.parallel = parallel;
    }

    public static MultiAgentReviewer create(ReviewSettings settings, LlmClientCache cache) {
        ReviewOrchestrator orchestrator = ReviewOrchestrator.create(cache, settings.backend(),
                settings.creativity(), settings.enabledCategories(), settings.reviewerTimeout());
        ConsolidationEngine engine = ConsolidationEngine.create(cache, settings.backend(),
                settings.creativity(), settings.maxRetries());
        return new MultiAgentReviewer(orchestrator, engine, new ReviewCommentFormatter(),
                new DiffFileCollector(), settings.parallel());
    }

    public ReviewOrchestrator orchestrator() {
        return orchestrator;
    }

    /** Reviews plain code; every comment is pinned to {@code filePath}. */
    public ReviewOutcome reviewCode(String code, String filePath, boolean diffOnly) {
        return run(code, filePath, List.of(), diffOnly);
    }

    /** Reviews a unified diff; comments are pinned to the files its headers name. */
    public ReviewOutcome reviewDiff(String diff, boolean diffOnly) {
        return run(diff, diffFiles.primaryPath(diff, UNKNOWN_FILE), diffFiles.collectPaths(diff), diffOnly);
    }

    /**
     * Reviews a diff with the full post-change file alongside it, in diff-only mode.
     * When the file cannot be read this is a plain {@link #reviewDiff} instead.
     */
    public ReviewOutcome reviewDiffWithContext(String diff, Path file) {
        String fullFile;
        try {
            fullFile = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Cannot read {} ({}); falling back to a diff-only review", file, e.getMessage());
            return reviewDiff(diff, false);
        }
        log.info("Reviewing diff with file context: {}", file);

        return run(withContext(diff, fullFile), diffFiles.primaryPath(diff, file.toString()),
                diffFiles.collectPaths(diff), true);
    }

    static String withContext(String diff, String fullFile) {
        return "DIFF TO REVIEW:\n" + diff + "\n\n"
                + "FULL FILE CONTEXT:\n" + fullFile + "\n\n"
                + "INSTRUCTIONS: Focus the review on the changes in the DIFF section above. Use the FULL FILE CONTEXT "
                + "only to understand the surrounding code and to make the recommendations more accurate.";
    }

    private ReviewOutcome run(String payload, String primaryFilePath, List<String> knownPaths, boolean diffOnly) {
        ReviewCycle cycle = new ReviewCycle();

        cycle.moveTo(ReviewCycleState.DISPATCHING);
        int dispatched = orchestrator.enabledCategories().size();
        if (dispatched == 0) {
            cycle.degrade("no reviewers enabled");
            return noReview(cycle);
        }

        cycle.moveTo(ReviewCycleState.COLLECTING);
        List<ReviewerResult> results = orchestrator.run(payload, diffOnly, parallel);
        if (results.isEmpty()) {
            cycle.degrade("no reviewer completed");
            return noReview(cycle);
        }
        if (results.size() < dispatched) {
            cycle.degrade((dispatched - results.size()) + " of " + dispatched + " reviewer(s) failed");
        }

        cycle.enter(ReviewCycleState.CONSOLIDATING);
        ConsolidatedResult consolidated = consolidation.consolidate(results, payload);
        log.info("Consolidated {} review(s): score {}/10, {} critical issue(s)",
                results.size(), consolidated.overallScore(), consolidated.criticalIssues().size());

        cycle.enter(ReviewCycleState.RENDERING);
        ConsolidationEngine.CommentBatch batch = consolidation.generate(consolidated, primaryFilePath, knownPaths);
        if (batch.degraded()) {
            cycle.degrade("comment generation fell back to an empty list");
        }
        String markdown = formatter.toMarkdown(batch.comments());

        cycle.moveTo(ReviewCycleState.DONE);
        return new ReviewOutcome(consolidated, batch.comments(), markdown, cycle.degraded(), cycle.history());
    }

    private static ReviewOutcome noReview(ReviewCycle cycle) {
        log.error("No review possible");
        cycle.moveTo(ReviewCycleState.DONE);
        return new ReviewOutcome(null, List.of(), null, true, cycle.history());
    }
}
