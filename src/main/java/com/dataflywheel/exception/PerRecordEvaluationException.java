package com.dataflywheel.exception;

public class PerRecordEvaluationException extends FlywheelException {
    public PerRecordEvaluationException(String message) {
        super(message);
    }

    public PerRecordEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
