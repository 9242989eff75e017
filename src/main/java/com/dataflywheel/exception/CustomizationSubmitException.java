package com.dataflywheel.exception;

public class CustomizationSubmitException extends FlywheelException {
    public CustomizationSubmitException(String message) {
        super(message);
    }

    public CustomizationSubmitException(String message, Throwable cause) {
        super(message, cause);
    }
}
