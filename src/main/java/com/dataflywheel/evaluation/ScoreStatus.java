package com.dataflywheel.evaluation;

public enum ScoreStatus {
    SCORED,
    SKIPPED
}
