package org.example.progress.service;

public enum ProgressFailureReason {
    INVALID_RAW_VALUE,
    NO_ACTIVE_MEDIUM,
    INVALID_SETTING,
    LAST_ACTIVE_MEDIUM,
    PROGRESS_NOT_FOUND
}
