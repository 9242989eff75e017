package com.dataflywheel.exception;

public class EvaluatorUnavailableException extends FlywheelException {
    public EvaluatorUnavailableException(String message) {
        super(message);
    }

    public EvaluatorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
