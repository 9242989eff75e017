package com.dataflywheel.exception;

public class JobDeadlineExceededException extends FlywheelException {
    public JobDeadlineExceededException(String message) {
        super(message);
    }

    public JobDeadlineExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
