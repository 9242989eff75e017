package com.dataflywheel.exception;

public class RecordStoreUnavailableException extends DatasetException {
    public RecordStoreUnavailableException(String message) {
        super(message);
    }

    public RecordStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
