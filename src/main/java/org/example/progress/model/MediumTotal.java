package org.example.progress.model;

import java.math.BigDecimal;

public record MediumTotal(
        BigDecimal pages,
        long audioSeconds
) {
}
