package org.example.progress.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record CalendarDay(
        LocalDate date,
        BigDecimal pages,
        long audioMinutes,
        List<String> bookIds,
        List<String> completedBookIds,
        boolean completionDay
) {

    public boolean hasActivity() {
        return !bookIds.isEmpty();
    }
}
