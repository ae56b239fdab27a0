package org.example.progress.service;

/**
 * Rejected progress operation. The reason code lets the calling layer render
 * a specific message instead of a generic failure; no state has been mutated.
 */
public class ProgressException extends RuntimeException {

    private final ProgressFailureReason reason;

    public ProgressException(ProgressFailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ProgressException(ProgressFailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public ProgressFailureReason getReason() {
        return reason;
    }
}
