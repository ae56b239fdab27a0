package org.example.progress.model;

import java.time.LocalDate;

/**
 * Longest runs of reading and non-reading days inside a date range. Spans are
 * null when the range has no day of that kind.
 */
public record StreakSummary(
        LocalDate from,
        LocalDate to,
        DateSpan longestStreak,
        DateSpan longestGap,
        int currentStreak
) {
}
