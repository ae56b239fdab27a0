package org.example.progress.model;

import java.time.YearMonth;
import java.util.List;

public record ReadingCalendar(
        YearMonth month,
        List<CalendarDay> days,
        boolean hasActivity,
        YearMonth previousMonth,
        YearMonth nextMonth
) {
}
