package com.dataflywheel.customization;

public enum CustomizationState {
    SUBMITTED,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
