package org.example.progress.model;

import org.example.progress.entity.MediumFormat;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record ProgressSnapshot(
        String progressId,
        String readerId,
        String bookId,
        String contextId,
        ReadingState state,
        SyncStatus status,
        BigDecimal percent,
        Integer currentPage,
        Integer totalPages,
        List<MediumFormat> activeFormats,
        List<MediumSnapshot> media,
        BigDecimal ledgerDelta,
        Integer pagesLeft,
        BigDecimal averagePagesPerDay,
        Integer estimatedDaysRemaining,
        LocalDateTime completedAt
) {

    public MediumSnapshot medium(MediumFormat format) {
        return media.stream()
                .filter(state -> state.medium() == format)
                .findFirst()
                .orElse(null);
    }
}
