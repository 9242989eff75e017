package com.dataflywheel.job;

import java.util.EnumSet;
import java.util.Set;

public enum JobState {
    CREATED,
    LOADING_DATA,
    BASELINE_EVAL,
    EVALUATING_CANDIDATES,
    AGGREGATING,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    public boolean canTransitionTo(JobState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return successors().contains(next);
    }

    private Set<JobState> successors() {
        return switch (this) {
            case CREATED -> EnumSet.of(LOADING_DATA);
            case LOADING_DATA -> EnumSet.of(BASELINE_EVAL);
            case BASELINE_EVAL -> EnumSet.of(EVALUATING_CANDIDATES);
            case EVALUATING_CANDIDATES -> EnumSet.of(AGGREGATING);
            case AGGREGATING -> EnumSet.of(COMPLETE);
            default -> EnumSet.noneOf(JobState.class);
        };
    }
}
