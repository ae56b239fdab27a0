package org.example.progress.model;

import org.example.progress.entity.MediumFormat;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record DayTotal(
        LocalDate date,
        BigDecimal pages,
        long audioSeconds,
        Map<MediumFormat, MediumTotal> byMedium,
        Map<String, MediumTotal> byBook,
        List<String> bookIds
) {
}
