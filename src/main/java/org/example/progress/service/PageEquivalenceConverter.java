package org.example.progress.service;

import org.example.progress.entity.MediumFormat;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Maps raw positions of any format onto page-equivalents of the reference
 * edition. All arithmetic is exact decimal; percents and equivalents keep two
 * decimals, projected positions are whole pages or seconds (round-half-up).
 */
@Component
public class PageEquivalenceConverter {

    static final int SCALE = 2;
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    /**
     * @param medium      format the position belongs to
     * @param rawValue    page number, or seconds into the recording for audio
     * @param totalPages  reference page count; unknown means no contribution
     * @param mediumTotal the format's own total (edition pages or recording
     *                    seconds), null when the format has no length of its own
     */
    public Optional<BigDecimal> toPagesEquivalent(
            MediumFormat medium,
            BigDecimal rawValue,
            Integer totalPages,
            BigDecimal mediumTotal) {
        if (totalPages == null || totalPages <= 0 || rawValue == null) {
            return Optional.empty();
        }
        BigDecimal reference = BigDecimal.valueOf(totalPages);
        if (medium.isPageBased()) {
            if (mediumTotal == null || mediumTotal.signum() <= 0 || mediumTotal.compareTo(reference) == 0) {
                return Optional.of(rawValue.setScale(SCALE, RoundingMode.HALF_UP));
            }
            return Optional.of(scale(reference, rawValue, mediumTotal));
        }
        if (mediumTotal == null || mediumTotal.signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(scale(reference, rawValue, mediumTotal));
    }

    public BigDecimal toPercent(BigDecimal pagesEquivalent, int totalPages) {
        if (totalPages <= 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        BigDecimal percent = pagesEquivalent
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(totalPages), SCALE, RoundingMode.HALF_UP);
        return percent.min(HUNDRED.setScale(SCALE));
    }

    /**
     * Raw position in a format of length {@code mediumTotal} that corresponds
     * to {@code percent}.
     */
    public BigDecimal projectRaw(BigDecimal mediumTotal, BigDecimal percent) {
        return mediumTotal
                .multiply(percent)
                .divide(HUNDRED, 0, RoundingMode.HALF_UP);
    }

    public int roundPages(BigDecimal pages) {
        return pages.setScale(0, RoundingMode.HALF_UP).intValueExact();
    }

    /**
     * Content seconds covered while listening {@code listenedSeconds} at
     * {@code speed}. Applied once, when the listening time is captured.
     */
    public long adjustForSpeed(long listenedSeconds, BigDecimal speed) {
        return BigDecimal.valueOf(listenedSeconds)
                .multiply(speed)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    /**
     * Wall-clock seconds needed to cover {@code contentSeconds} at {@code speed}.
     */
    public long wallClockSeconds(long contentSeconds, BigDecimal speed) {
        if (speed == null || speed.signum() <= 0) {
            return contentSeconds;
        }
        return BigDecimal.valueOf(contentSeconds)
                .divide(speed, 0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    private BigDecimal scale(BigDecimal reference, BigDecimal rawValue, BigDecimal mediumTotal) {
        return reference
                .multiply(rawValue)
                .divide(mediumTotal, SCALE, RoundingMode.HALF_UP);
    }
}
