package com.dataflywheel.exception;

public class CustomizationTimeoutException extends FlywheelException {
    public CustomizationTimeoutException(String message) {
        super(message);
    }

    public CustomizationTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
