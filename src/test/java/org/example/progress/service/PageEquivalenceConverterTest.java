package org.example.progress.service;

import org.example.progress.entity.MediumFormat;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PageEquivalenceConverterTest {

    private final PageEquivalenceConverter converter = new PageEquivalenceConverter();

    @Test
    void toPagesEquivalent_paperWithoutOverrideIsTheRawPage() {
        Optional<BigDecimal> equivalent = converter.toPagesEquivalent(
                MediumFormat.PAPER, new BigDecimal("120"), 200, null);

        assertEquals(new BigDecimal("120.00"), equivalent.orElseThrow());
    }

    @Test
    void toPagesEquivalent_scalesEditionWithItsOwnPageCount() {
        Optional<BigDecimal> equivalent = converter.toPagesEquivalent(
                MediumFormat.EBOOK, new BigDecimal("200"), 200, new BigDecimal("400"));

        assertEquals(new BigDecimal("100.00"), equivalent.orElseThrow());
    }

    @Test
    void toPagesEquivalent_audioHalfwayIsHalfTheBook() {
        Optional<BigDecimal> equivalent = converter.toPagesEquivalent(
                MediumFormat.AUDIO, new BigDecimal("18000"), 300, new BigDecimal("36000"));

        assertEquals(new BigDecimal("150.00"), equivalent.orElseThrow());
        assertEquals(new BigDecimal("50.00"), converter.toPercent(equivalent.orElseThrow(), 300));
    }

    @Test
    void toPagesEquivalent_unknownTotalsProduceNothing() {
        assertTrue(converter.toPagesEquivalent(MediumFormat.PAPER, BigDecimal.TEN, null, null).isEmpty());
        assertTrue(converter.toPagesEquivalent(MediumFormat.AUDIO, BigDecimal.TEN, 300, null).isEmpty());
    }

    @Test
    void toPercent_lastPageIsComplete() {
        assertEquals(new BigDecimal("100.00"), converter.toPercent(new BigDecimal("200.00"), 200));
    }

    @Test
    void toPercent_isCappedAtHundred() {
        assertEquals(new BigDecimal("100.00"), converter.toPercent(new BigDecimal("250.00"), 200));
    }

    @Test
    void toPercent_roundsHalfUpToTwoDecimals() {
        assertEquals(new BigDecimal("33.33"), converter.toPercent(new BigDecimal("1"), 3));
        assertEquals(new BigDecimal("66.67"), converter.toPercent(new BigDecimal("2"), 3));
    }

    @Test
    void projectRaw_roundsToWholeUnits() {
        assertEquals(new BigDecimal("200"), converter.projectRaw(new BigDecimal("400"), new BigDecimal("50.00")));
        assertEquals(new BigDecimal("134"), converter.projectRaw(new BigDecimal("401"), new BigDecimal("33.33")));
    }

    @Test
    void adjustForSpeed_multipliesListeningTime() {
        assertEquals(10_800L, converter.adjustForSpeed(7_200L, new BigDecimal("1.5")));
    }

    @Test
    void wallClockSeconds_dividesByPlaybackSpeed() {
        assertEquals(24_000L, converter.wallClockSeconds(36_000L, new BigDecimal("1.5")));
        assertEquals(36_000L, converter.wallClockSeconds(36_000L, null));
    }
}
