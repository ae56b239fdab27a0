package org.example.progress.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record PeriodSummary(
        StatsPeriod period,
        LocalDate from,
        LocalDate to,
        BigDecimal totalPages,
        long audioSeconds,
        int readingDays,
        BigDecimal averagePagesPerDay,
        BestDay bestDay,
        int booksCompleted,
        List<FormatShare> formatShares,
        Map<String, MediumTotal> byBook
) {
}
