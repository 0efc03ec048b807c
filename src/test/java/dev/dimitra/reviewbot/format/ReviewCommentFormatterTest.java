package dev.dimitra.reviewbot.format;

import dev.dimitra.reviewbot.model.ReviewComment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReviewCommentFormatterTest {

    private final ReviewCommentFormatter formatter = new ReviewCommentFormatter();

    @Test
    void emptyListIsPositiveMessage() {
        assertThat(formatter.toMarkdown(List.of()))
                .isEqualTo("✅ **No issues found!** The code looks good and follows best practices.");
        assertThat(formatter.toMarkdown(null)).isEqualTo(ReviewCommentFormatter.NO_ISSUES);
    }

    @Test
    void groupsByFileSortedAndOrdersByLine() {
        String md = formatter.toMarkdown(List.of(
                new ReviewComment("src/z.js", 9, "late"),
                new ReviewComment("src/a.js", null, "no line"),
                new ReviewComment("src/a.js", 12, "second"),
                new ReviewComment("src/a.js", 3, "first")));

        assertThat(md).startsWith("## 🔍 **Code Review Results**");
        assertThat(md.indexOf("File: src/a.js")).isLessThan(md.indexOf("File: src/z.js"));
        assertThat(md).contains("### 📁 **File: src/a.js** (3 issues)", "### 📁 **File: src/z.js** (1 issue)");
        assertThat(md.indexOf("**Line 3:** first"))
                .isLessThan(md.indexOf("**Line 12:** second"))
                .isLessThan(md.indexOf("**Line N/A:** no line"));
        assertThat(md).contains("**📊 Summary:** Found 4 issues across 2 files.");
    }

    @Test
    void singularWording() {
        String md = formatter.toMarkdown(List.of(new ReviewComment("a.py", 1, "x")));

        assertThat(md).contains("Found 1 issue across 1 file.");
    }
}
