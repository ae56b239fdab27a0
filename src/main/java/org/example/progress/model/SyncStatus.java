package org.example.progress.model;

public enum SyncStatus {
    APPLIED,
    UNCHANGED,
    POSITION_ONLY,   // no resolvable total: position stored, no equivalence computed
    ALREADY_COMPLETE
}
