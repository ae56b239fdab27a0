package org.example.progress.model;

public enum ReadingState {
    UNSTARTED,
    IN_PROGRESS,
    COMPLETE
}
