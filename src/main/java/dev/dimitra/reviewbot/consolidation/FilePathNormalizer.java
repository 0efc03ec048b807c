package dev.dimitra.reviewbot.consolidation;

import dev.dimitra.reviewbot.model.ReviewComment;

import java.util.ArrayList;
import java.util.List;

/**
 * Pins every comment to a path from the caller's closed set.
 * <ul>
 *   <li>no known paths: every comment gets the primary path</li>
 *   <li>claimed path equals a known path, or ends with it on a segment boundary: that known path (longest match wins)</li>
 *   <li>otherwise: {@code knownPaths[index % knownPaths.size()]}</li>
 * </ul>
 * The round-robin branch is an approximation; the backend gives no reliable line-to-file signal.
 */
public class FilePathNormalizer {

    public List<ReviewComment> normalize(List<ReviewComment> comments, String primaryFilePath, List<String> knownPaths) {
        List<ReviewComment> out = new ArrayList<>(comments.size());
        boolean haveKnown = knownPaths != null && !knownPaths.isEmpty();
        for (int i = 0; i < comments.size(); i++) {
            ReviewComment c = comments.get(i);
            String path = haveKnown ? resolve(c.filePath(), knownPaths, i) : primaryFilePath;
            out.add(c.withFilePath(path));
        }
        return out;
    }

    private static String resolve(String claimed, List<String> known, int index) {
        if (claimed != null && !claimed.isBlank() && !"unknown".equalsIgnoreCase(claimed)) {
            if (known.contains(claimed)) return claimed;
            String best = null;
            for (String k : known) {
                if (claimed.endsWith("/" + k) && (best == null || k.length() > best.length())) best = k;
            }
            if (best != null) return best;
        }
        return known.get(index % known.size());
    }
}
