package org.example.progress.model;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Optional per-format settings supplied when a format is activated or
 * reconfigured. Null fields leave the current value untouched.
 */
public record MediumSettings(
        Integer totalPagesOverride,
        Duration audioLength,
        BigDecimal playbackSpeed
) {

    public static MediumSettings none() {
        return new MediumSettings(null, null, null);
    }

    public static MediumSettings pages(int totalPagesOverride) {
        return new MediumSettings(totalPagesOverride, null, null);
    }

    public static MediumSettings audio(Duration audioLength, BigDecimal playbackSpeed) {
        return new MediumSettings(null, audioLength, playbackSpeed);
    }
}
