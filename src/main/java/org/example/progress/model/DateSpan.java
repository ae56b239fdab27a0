package org.example.progress.model;

import java.time.LocalDate;

public record DateSpan(
        LocalDate start,
        LocalDate end,
        int days
) {
}
