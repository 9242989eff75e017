package com.dataflywheel.exception;

public class FlywheelException extends RuntimeException {
    public FlywheelException(String message) {
        super(message);
    }

    public FlywheelException(String message, Throwable cause) {
        super(message, cause);
    }
}
