package com.dataflywheel.exception;

public class RecordsNotFoundException extends DatasetException {
    public RecordsNotFoundException(String message) {
        super(message);
    }

    public RecordsNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
