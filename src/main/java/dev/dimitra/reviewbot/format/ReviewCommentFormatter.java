package dev.dimitra.reviewbot.format;

import dev.dimitra.reviewbot.model.ReviewComment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders review comments as one pull-request markdown body, grouped by file.
 */
public class ReviewCommentFormatter {

    public static final String NO_ISSUES = "✅ **No issues found!** The code looks good and follows best practices.";
    static final String UNKNOWN_FILE = "unknown";

    private static final Comparator<ReviewComment> BY_LINE =
            Comparator.comparing(ReviewComment::lineNumber, Comparator.nullsLast(Comparator.naturalOrder()));

    public String toMarkdown(List<ReviewComment> comments) {
        if (comments == null || comments.isEmpty()) {
            return NO_ISSUES;
        }

        Map<String, List<ReviewComment>> byFile = new TreeMap<>();
        for (ReviewComment c : comments) {
            String path = c.filePath() == null || c.filePath().isBlank() ? UNKNOWN_FILE : c.filePath();
            byFile.computeIfAbsent(path, k -> new ArrayList<>()).add(c);
        }

        StringBuilder md = new StringBuilder("## 🔍 **Code Review Results**\n\n");
        for (Map.Entry<String, List<ReviewComment>> e : byFile.entrySet()) {
            List<ReviewComment> issues = new ArrayList<>(e.getValue());
            issues.sort(BY_LINE);
            md.append("### 📁 **File: ").append(e.getKey()).append("** (")
              .append(plural(issues.size(), "issue")).append(")\n\n");
            for (ReviewComment c : issues) {
                md.append("**Line ").append(c.lineNumber() == null ? "N/A" : c.lineNumber()).append(":** ")
                  .append(c.reviewComment()).append("\n\n");
            }
            md.append("---\n\n");
        }

        md.append("**📊 Summary:** Found ").append(plural(comments.size(), "issue"))
          .append(" across ").append(plural(byFile.size(), "file")).append(".\n\n");
        md.append("Please review the feedback above and address any critical issues before merging.");
        return md.toString();
    }

    private static String plural(int n, String noun) {
        return n + " " + noun + (n == 1 ? "" : "s");
    }
}
