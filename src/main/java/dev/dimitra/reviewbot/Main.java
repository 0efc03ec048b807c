package dev.dimitra.reviewbot;

import dev.dimitra.reviewbot.config.EnvConfig;
import dev.dimitra.reviewbot.config.LlmSettings;
import dev.dimitra.reviewbot.config.ReviewSettings;
import dev.dimitra.reviewbot.consolidation.ConsolidatedReportWriter;
import dev.dimitra.reviewbot.llm.LlmClientCache;
import dev.dimitra.reviewbot.llm.LlmRouter;
import dev.dimitra.reviewbot.review.MultiAgentReviewer;
import dev.dimitra.reviewbot.review.ReviewOutcome;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class Main {
    // ---- ENTRY POINT ----
    // usage: Main [payload-file [context-file]]   (payload from stdin when no file is given)
    public static void main(String[] args) throws Exception {
        int code = run(args, EnvConfig.system(), System.in);
        if (code != 0) System.exit(code);
    }

    static int run(String[] args, EnvConfig env, InputStream stdin) throws IOException {
        ReviewSettings settings;
        LlmSettings llmSettings;
        try {
            settings = ReviewSettings.fromEnv(env);
            llmSettings = LlmSettings.fromEnv(env);
        } catch (IllegalArgumentException e) {
            return fail(e.getMessage());
        }

        String payload;
        String filePath;
        if (args.length > 0) {
            Path p = Paths.get(args[0]);
            if (!Files.isReadable(p)) return fail("Cannot read " + p);
            payload = Files.readString(p, StandardCharsets.UTF_8);
            filePath = p.getFileName().toString();
        } else {
            payload = new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
            filePath = MultiAgentReviewer.UNKNOWN_FILE;
        }
        if (payload.isBlank()) return fail("Nothing to review: empty input");

        MultiAgentReviewer reviewer;
        try {
            reviewer = MultiAgentReviewer.create(settings, new LlmClientCache(new LlmRouter(llmSettings)));
        } catch (IllegalArgumentException e) {
            // missing credentials surface here, when the first hosted client is built
            return fail(e.getMessage());
        }

        ReviewOutcome outcome;
        if (args.length > 1) {
            outcome = reviewer.reviewDiffWithContext(payload, Paths.get(args[1]));
        } else if (looksLikeDiff(payload)) {
            outcome = reviewer.reviewDiff(payload, settings.diffOnly());
        } else {
            outcome = reviewer.reviewCode(payload, filePath, settings.diffOnly());
        }

        if (!outcome.reviewPossible()) return fail("No review possible: no reviewer completed successfully");

        ConsolidatedReportWriter writer = new ConsolidatedReportWriter();
        switch (settings.output()) {
            case JSON:
                System.out.println(writer.commentsToJson(outcome.comments()));
                break;
            case REPORT:
                System.out.println(writer.toJson(outcome.consolidated()));
                break;
            default:
                System.out.println(outcome.markdown());
        }
        return 0;
    }

    static boolean looksLikeDiff(String payload) {
        return payload.contains("diff --git ") || payload.contains("\n+++ b/") || payload.startsWith("+++ b/");
    }

    private static int fail(String msg) {
        System.err.println("[ERROR] " + msg);
        return 1;
    }
}
