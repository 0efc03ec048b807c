package dev.dimitra.reviewbot.analysis;

import dev.dimitra.reviewbot.llm.BackendKind;
import dev.dimitra.reviewbot.llm.LlmClient;
import dev.dimitra.reviewbot.llm.LlmClientCache;
import dev.dimitra.reviewbot.model.ReviewCategory;
import dev.dimitra.reviewbot.model.ReviewerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * Reviews one payload from one perspective: renders the category prompt, calls the backend and parses the reply.
 * Backend failures come back as {@code null} so the orchestrator can drop this reviewer and keep the others.
 */
public class SpecializedReviewer {
    private static final Logger log = LoggerFactory.getLogger(SpecializedReviewer.class);

    static final double MIN_TEMPERATURE = 0.2;
    static final int MAX_TOKENS = 2000;

    private final ReviewCategory category;
    private final LlmClient llm;
    private final PromptTemplate template;
    private final ResponseParser parser;
    private final double temperature;
    private final String name;

    public SpecializedReviewer(ReviewCategory category, LlmClientCache cache, BackendKind kind, double creativity) {
        this(category, cache.get(category.key() + "_agent", kind, creativity), new ResponseParser(), creativity);
    }

    public SpecializedReviewer(ReviewCategory category, LlmClient llm, ResponseParser parser, double creativity) {
        this.category = Objects.requireNonNull(category, "category");
        this.llm = Objects.requireNonNull(llm, "llm");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.template = PromptTemplates.forCategory(category);
        this.temperature = Math.max(MIN_TEMPERATURE, creativity);
        this.name = category.displayName().replace(" ", "") + "Reviewer";
    }

    public ReviewCategory category() {
        return category;
    }

    public String name() {
        return name;
    }

    /**
     * @return the parsed review, or null when the backend failed or replied with nothing
     */
    public ReviewerResult review(String payload, boolean diffOnly) {
        String prompt = template.render(payload, diffOnly);
        String reply;
        try {
            reply = llm.complete(PromptTemplates.systemPrompt(category), prompt, temperature, MAX_TOKENS).text();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted while waiting for the backend", name);
            return null;
        } catch (IOException | RuntimeException e) {
            log.error("{} backend call failed: {}", name, e.getMessage());
            return null;
        }

        if (reply == null || reply.isBlank()) {
            log.error("{} returned empty response", name);
            return null;
        }
        ReviewerResult result = parser.parse(category, name, reply);
        log.debug("{} completed: score {}, {} finding(s)", name, result.score(), result.findings().size());
        return result;
    }
}
