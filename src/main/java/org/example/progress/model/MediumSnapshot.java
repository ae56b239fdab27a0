package org.example.progress.model;

import org.example.progress.entity.MediumFormat;

import java.math.BigDecimal;
import java.time.Duration;

public record MediumSnapshot(
        MediumFormat medium,
        Integer currentPage,
        Integer totalPages,
        Duration audioPosition,
        Duration audioLength,
        BigDecimal playbackSpeed,
        Duration adjustedAudioLength
) {
}
