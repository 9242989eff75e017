package com.dataflywheel.job;

public enum CandidateStage {
    PENDING,
    EVAL_PRE,
    CUSTOMIZING,
    EVAL_POST,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
