package dev.dimitra.reviewbot.review;

import dev.dimitra.reviewbot.model.ConsolidatedResult;
import dev.dimitra.reviewbot.model.ReviewComment;

import java.util.List;

/**
 * What one review cycle produced.
 *
 * @param consolidated null when no review was possible (nothing enabled, or every reviewer failed)
 * @param comments     line-anchored comments; empty both for a clean review and for a degraded one
 * @param markdown     comments rendered for a pull request, null when no review was possible
 * @param degraded     true when any stage fell back to best-effort output
 * @param states       the stages the cycle went through, in order
 */
public record ReviewOutcome(
        ConsolidatedResult consolidated,
        List<ReviewComment> comments,
        String markdown,
        boolean degraded,
        List<ReviewCycleState> states
) {
    public ReviewOutcome {
        comments = comments == null ? List.of() : List.copyOf(comments);
        states = List.copyOf(states);
    }

    public boolean reviewPossible() {
        return consolidated != null;
    }
}
