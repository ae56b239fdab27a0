package org.example.progress.service;

import org.example.progress.entity.MediumFormat;

public class NoActiveMediumException extends ProgressException {

    private final MediumFormat medium;

    public NoActiveMediumException(MediumFormat medium) {
        super(ProgressFailureReason.NO_ACTIVE_MEDIUM, "Format " + medium + " is not active for this book");
        this.medium = medium;
    }

    public MediumFormat getMedium() {
        return medium;
    }
}
