package org.example.progress.model;

import org.example.progress.entity.MediumFormat;

import java.math.BigDecimal;

public record FormatShare(
        MediumFormat medium,
        BigDecimal pages,
        BigDecimal percent
) {
}
