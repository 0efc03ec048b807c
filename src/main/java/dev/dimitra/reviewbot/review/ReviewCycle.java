package dev.dimitra.reviewbot.review;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Records the path one review cycle takes through {@link ReviewCycleState}. Not thread-safe; a cycle
 * is driven by a single caller thread.
 */
final class ReviewCycle {
    private static final Logger log = LoggerFactory.getLogger(ReviewCycle.class);

    private final List<ReviewCycleState> history = new ArrayList<>();
    private ReviewCycleState state = ReviewCycleState.IDLE;
    private boolean degraded;

    ReviewCycle() {
        history.add(state);
    }

    void moveTo(ReviewCycleState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Illegal review cycle transition " + state + " -> " + next);
        }
        log.debug("Review cycle {} -> {}", state, next);
        state = next;
        history.add(next);
    }

    /** Enters DEGRADED the first time; later calls only log the reason. */
    void degrade(String reason) {
        log.warn("Review cycle degraded: {}", reason);
        if (!degraded) {
            degraded = true;
            moveTo(ReviewCycleState.DEGRADED);
        }
    }

    /** Next working stage; skipped over DEGRADED when the cycle already sits there. */
    void enter(ReviewCycleState stage) {
        if (state != stage) moveTo(stage);
    }

    boolean degraded() {
        return degraded;
    }

    List<ReviewCycleState> history() {
        return List.copyOf(history);
    }
}
