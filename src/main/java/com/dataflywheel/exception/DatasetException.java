package com.dataflywheel.exception;

public class DatasetException extends FlywheelException {
    public DatasetException(String message) {
        super(message);
    }

    public DatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}
