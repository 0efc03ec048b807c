package dev.dimitra.reviewbot.diff;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lists the files a unified diff touches, using the post-change path.
 */
public class DiffFileCollector {

    private static final Pattern GIT_HEADER = Pattern.compile("diff --git a/(\\S+) b/(\\S+)");
    private static final Pattern NEW_FILE = Pattern.compile("\\+\\+\\+ b/(\\S+)");

    /**
     * {@code diff --git} headers win; {@code +++ b/} lines are only consulted when there are none.
     *
     * @return distinct paths in first-seen order, empty when the text has neither marker
     */
    public List<String> collectPaths(String diff) {
        if (diff == null || diff.isBlank()) return List.of();
        List<String> paths = collect(GIT_HEADER, 2, diff);
        return paths.isEmpty() ? collect(NEW_FILE, 1, diff) : paths;
    }

    /** First path of the diff, or {@code fallback} when nothing could be extracted. */
    public String primaryPath(String diff, String fallback) {
        List<String> paths = collectPaths(diff);
        return paths.isEmpty() ? fallback : paths.get(0);
    }

    private static List<String> collect(Pattern pattern, int group, String diff) {
        Set<String> out = new LinkedHashSet<>();
        Matcher m = pattern.matcher(diff);
        while (m.find()) {
            out.add(m.group(group));
        }
        return List.copyOf(out);
    }
}
