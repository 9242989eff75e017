package com.dataflywheel.exception;

public class CustomizationFailedException extends FlywheelException {
    public CustomizationFailedException(String message) {
        super(message);
    }

    public CustomizationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
