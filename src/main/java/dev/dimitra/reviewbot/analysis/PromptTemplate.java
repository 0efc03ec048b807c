package dev.dimitra.reviewbot.analysis;

import dev.dimitra.reviewbot.model.ReviewCategory;

import java.util.List;

/**
 * Category-specific wording for one reviewer, rendered in full-file or diff-only mode.
 */
public record PromptTemplate(
        ReviewCategory category,
        String expertRole,
        String issueNoun,
        List<String> focusAreas,
        String perIssueInstructions,
        String example
) {
    public PromptTemplate {
        focusAreas = List.copyOf(focusAreas);
    }

    public String render(String payload, boolean diffOnly) {
        return diffOnly ? renderDiffOnly(payload) : renderFull(payload);
    }

    private String renderFull(String payload) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are ").append(expertRole).append(".\n\n");
        sb.append("Analyze this code for ").append(issueNoun).append(" with EXACT LINE NUMBERS:\n\n");
        sb.append("```\n").append(numberLines(payload)).append("\n```\n\n");
        sb.append("CRITICAL: For each ").append(issueNoun).append(" found, you MUST:\n");
        sb.append("- Start with \"Line X:\" where X is the specific line number\n");
        sb.append(perIssueInstructions).append("\n\n");
        sb.append("Focus on these aspects:\n");
        for (int i = 0; i < focusAreas.size(); i++) {
            sb.append(i + 1).append(". ").append(focusAreas.get(i)).append('\n');
        }
        sb.append("\nExample format: \"").append(example).append("\"\n\n");
        sb.append("Label each finding with \"Issue:\" and its severity (Critical/High/Medium/Low), ");
        sb.append("and each fix with \"Recommend:\". Be thorough but concise.");
        return sb.toString();
    }

    private String renderDiffOnly(String payload) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are ").append(expertRole).append(" reviewing code changes.\n\n");
        sb.append("CRITICAL RESTRICTION: You are reviewing a DIFF with context. You MUST ONLY comment on the lines ");
        sb.append("that are being ADDED or CHANGED in the diff (lines starting with '+' or modified lines). ");
        sb.append("DO NOT comment on context lines or unchanged code.\n\n");
        sb.append(payload).append("\n\n");
        sb.append("INSTRUCTIONS:\n");
        sb.append("- ONLY review the lines that are being added/changed in the diff\n");
        sb.append("- Use any surrounding or full-file context only to understand the change\n");
        sb.append("- For each ").append(issueNoun).append(" in the changed lines, start with \"Line X:\" format\n");
        sb.append(perIssueInstructions).append("\n\n");
        sb.append("Focus on these aspects in the CHANGED LINES ONLY: ");
        sb.append(String.join(", ", focusAreas)).append("\n\n");
        sb.append("Example: \"").append(example).append("\"\n\n");
        sb.append("Label each finding with \"Issue:\" and each fix with \"Recommend:\". IGNORE unchanged context lines.");
        return sb.toString();
    }

    /** Prefixes every line with its 1-based number, right-aligned to three columns. */
    static String numberLines(String code) {
        String[] lines = (code == null ? "" : code).split("\n", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            sb.append(String.format("%3d: %s", i + 1, lines[i]));
        }
        return sb.toString();
    }
}
