package com.dataflywheel.exception;

public class JobCancelledException extends FlywheelException {
    public JobCancelledException(String message) {
        super(message);
    }

    public JobCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
