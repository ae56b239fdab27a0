package org.example.progress.event;

import org.example.progress.entity.MediumFormat;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ProgressAdvancedEvent(
        String readerId,
        String bookId,
        String contextId,
        MediumFormat medium,
        LocalDate logDate,
        BigDecimal pagesEquivalent,
        BigDecimal percent
) {
}
