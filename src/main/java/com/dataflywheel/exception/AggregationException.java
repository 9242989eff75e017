package com.dataflywheel.exception;

public class AggregationException extends FlywheelException {
    public AggregationException(String message) {
        super(message);
    }

    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
