package org.example.progress.model;

public enum StatsPeriod {
    DAY,
    WEEK,    // rolling seven days ending at the anchor date
    MONTH,
    YEAR,
    CUSTOM
}
