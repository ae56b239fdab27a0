package org.example.progress.service;

public class InvalidRawValueException extends ProgressException {

    public InvalidRawValueException(String message) {
        super(ProgressFailureReason.INVALID_RAW_VALUE, message);
    }

    public InvalidRawValueException(String message, Throwable cause) {
        super(ProgressFailureReason.INVALID_RAW_VALUE, message, cause);
    }
}
