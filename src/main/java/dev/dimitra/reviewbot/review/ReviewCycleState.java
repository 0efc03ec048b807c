package dev.dimitra.reviewbot.review;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stages of one review cycle. {@link #DEGRADED} is sticky: once entered the cycle keeps producing
 * best-effort output and still ends in {@link #DONE}.
 */
public enum ReviewCycleState {
    IDLE,
    DISPATCHING,
    COLLECTING,
    CONSOLIDATING,
    RENDERING,
    DEGRADED,
    DONE;

    public boolean canMoveTo(ReviewCycleState next) {
        return successors().contains(next);
    }

    private Set<ReviewCycleState> successors() {
        switch (this) {
            case IDLE: return EnumSet.of(DISPATCHING);
            case DISPATCHING: return EnumSet.of(COLLECTING, DEGRADED);
            case COLLECTING: return EnumSet.of(CONSOLIDATING, DEGRADED);
            case CONSOLIDATING: return EnumSet.of(RENDERING);
            case RENDERING: return EnumSet.of(DONE, DEGRADED);
            case DEGRADED: return EnumSet.of(CONSOLIDATING, RENDERING, DONE);
            default: return EnumSet.noneOf(ReviewCycleState.class);
        }
    }
}
