package dev.dimitra.reviewbot.config;

import dev.dimitra.reviewbot.llm.BackendKind;
import dev.dimitra.reviewbot.model.ReviewCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * How a review cycle runs: which backend, how creative, which reviewers, and how patiently.
 */
public record ReviewSettings(
        BackendKind backend,
        double creativity,
        List<ReviewCategory> enabledCategories,
        boolean parallel,
        boolean diffOnly,
        Duration reviewerTimeout,
        int maxRetries,
        OutputMode output
) {
    private static final Logger log = LoggerFactory.getLogger(ReviewSettings.class);

    public static final double DEFAULT_CREATIVITY = 0.1;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_REVIEWER_TIMEOUT = Duration.ofSeconds(360);

    public ReviewSettings {
        creativity = Math.min(1.0, Math.max(0.0, creativity));
        enabledCategories = enabledCategories == null
                ? List.of(ReviewCategory.values())
                : List.copyOf(enabledCategories);
        reviewerTimeout = reviewerTimeout == null ? DEFAULT_REVIEWER_TIMEOUT : reviewerTimeout;
        maxRetries = Math.max(1, maxRetries);
        output = output == null ? OutputMode.MARKDOWN : output;
    }

    public static ReviewSettings defaults(BackendKind backend) {
        return new ReviewSettings(backend, DEFAULT_CREATIVITY, null, true, false,
                DEFAULT_REVIEWER_TIMEOUT, DEFAULT_MAX_RETRIES, OutputMode.MARKDOWN);
    }

    public static ReviewSettings fromEnv(EnvConfig env) {
        return new ReviewSettings(
                BackendKind.fromValue(env.optional("LLM_BACKEND")),
                env.doubleEnv("REVIEW_CREATIVITY", DEFAULT_CREATIVITY),
                parseCategories(env.optional("REVIEW_AGENTS")),
                !env.boolEnv("REVIEW_SEQUENTIAL", false),
                env.boolEnv("REVIEW_DIFF_ONLY", false),
                Duration.ofSeconds(Math.max(1, env.intEnv("REVIEW_AGENT_TIMEOUT_SECONDS", 360))),
                env.intEnv("REVIEW_MAX_RETRIES", DEFAULT_MAX_RETRIES),
                OutputMode.fromValue(env.optional("REVIEW_OUTPUT"))
        );
    }

    /** Comma-separated category keys; null means every category. Unknown keys are dropped. */
    static List<ReviewCategory> parseCategories(String csv) {
        if (csv == null || csv.isBlank()) return null;
        EnumSet<ReviewCategory> picked = EnumSet.noneOf(ReviewCategory.class);
        for (String part : csv.split(",")) {
            if (part.isBlank()) continue;
            Optional<ReviewCategory> c = ReviewCategory.fromKey(part);
            if (c.isPresent()) {
                picked.add(c.get());
            } else {
                log.warn("Ignoring unknown reviewer type '{}'", part.trim());
            }
        }
        return new ArrayList<>(picked);
    }
}
