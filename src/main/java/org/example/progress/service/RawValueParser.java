package org.example.progress.service;

import org.example.progress.entity.MediumFormat;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Validates and normalizes raw positions before they reach the synchronizer.
 * Pages must be whole non-negative numbers; audio positions are seconds and
 * may also be given as {@code H:MM:SS} or {@code MM:SS}.
 */
public final class RawValueParser {

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private RawValueParser() {
    }

    public static BigDecimal requireValid(MediumFormat medium, BigDecimal rawValue) {
        if (medium == null) {
            throw new InvalidRawValueException("Format is required");
        }
        if (rawValue == null) {
            throw new InvalidRawValueException("Position is required");
        }
        if (rawValue.signum() < 0) {
            throw new InvalidRawValueException("Position must not be negative: " + rawValue.toPlainString());
        }
        if (medium.isPageBased()) {
            BigDecimal stripped = rawValue.stripTrailingZeros();
            if (stripped.scale() > 0) {
                throw new InvalidRawValueException("Page must be a whole number: " + rawValue.toPlainString());
            }
            if (stripped.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0) {
                throw new InvalidRawValueException("Page is out of range: " + rawValue.toPlainString());
            }
            return stripped.setScale(0, RoundingMode.UNNECESSARY);
        }
        BigDecimal seconds = rawValue.setScale(0, RoundingMode.HALF_UP);
        if (seconds.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) > 0) {
            throw new InvalidRawValueException("Audio position is out of range: " + rawValue.toPlainString());
        }
        return seconds;
    }

    public static BigDecimal parse(MediumFormat medium, String rawValue) {
        if (medium == null) {
            throw new InvalidRawValueException("Format is required");
        }
        if (medium.isPageBased()) {
            String normalized = normalize(rawValue);
            if (!DIGITS.matcher(normalized).matches()) {
                throw new InvalidRawValueException("Invalid page value: '" + normalized + "'");
            }
            return requireValid(medium, new BigDecimal(normalized));
        }
        return BigDecimal.valueOf(parseDuration(rawValue).getSeconds());
    }

    public static Duration parseDuration(String rawValue) {
        String normalized = normalize(rawValue);
        String[] parts = normalized.split(":", -1);
        if (parts.length > 3) {
            throw new InvalidRawValueException("Invalid duration: '" + normalized + "'");
        }
        for (String part : parts) {
            if (!DIGITS.matcher(part).matches()) {
                throw new InvalidRawValueException("Invalid duration: '" + normalized + "'");
            }
        }
        try {
            if (parts.length == 1) {
                return Duration.ofSeconds(Long.parseLong(parts[0]));
            }
            long seconds = Long.parseLong(parts[parts.length - 1]);
            long minutes = Long.parseLong(parts[parts.length - 2]);
            long hours = parts.length == 3 ? Long.parseLong(parts[0]) : 0;
            if (seconds >= 60 || (parts.length == 3 && minutes >= 60)) {
                throw new InvalidRawValueException("Invalid duration: '" + normalized + "'");
            }
            return Duration.ofHours(hours).plusMinutes(minutes).plusSeconds(seconds);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidRawValueException("Duration is out of range: '" + normalized + "'", e);
        }
    }

    public static Duration requireValid(Duration duration) {
        if (duration == null) {
            throw new InvalidRawValueException("Duration is required");
        }
        if (duration.isNegative()) {
            throw new InvalidRawValueException("Duration must not be negative: " + duration);
        }
        return duration;
    }

    private static String normalize(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new InvalidRawValueException("Position is required");
        }
        return rawValue.trim();
    }
}
