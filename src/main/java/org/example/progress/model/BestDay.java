package org.example.progress.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record BestDay(
        LocalDate date,
        BigDecimal pages
) {
}
