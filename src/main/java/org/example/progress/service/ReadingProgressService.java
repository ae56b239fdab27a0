package org.example.progress.service;

import org.example.progress.entity.MediumFormat;
import org.example.progress.model.MediumSettings;
import org.example.progress.model.ProgressKey;
import org.example.progress.model.ProgressSnapshot;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Entry point for progress commands. Each mutation runs inside the lock for
 * its record, and the transaction commits before the lock is released.
 */
@Service
public class ReadingProgressService {

    private final ProgressUpdateService progressUpdateService;
    private final ProgressLockRegistry progressLockRegistry;
    private final Clock clock;

    public ReadingProgressService(
            ProgressUpdateService progressUpdateService,
            ProgressLockRegistry progressLockRegistry,
            Clock clock) {
        this.progressUpdateService = progressUpdateService;
        this.progressLockRegistry = progressLockRegistry;
        this.clock = clock;
    }

    public ProgressSnapshot reportProgress(
            String readerId,
            String bookId,
            String contextId,
            MediumFormat medium,
            BigDecimal rawValue,
            ZonedDateTime occurredAt) {
        BigDecimal validated = RawValueParser.requireValid(medium, rawValue);
        ProgressKey key = new ProgressKey(readerId, bookId, contextId);
        ZonedDateTime at = occurredAt == null ? now() : occurredAt;
        return progressLockRegistry.withLock(key, () -> progressUpdateService.report(key, medium, validated, at));
    }

    /**
     * Accepts a page number, or for audio a position such as {@code 1:05:30}.
     */
    public ProgressSnapshot reportProgress(
            String readerId,
            String bookId,
            String contextId,
            MediumFormat medium,
            String rawValue,
            ZonedDateTime occurredAt) {
        return reportProgress(readerId, bookId, contextId, medium, RawValueParser.parse(medium, rawValue), occurredAt);
    }

    public ProgressSnapshot logListening(
            String readerId,
            String bookId,
            String contextId,
            Duration listened,
            ZonedDateTime occurredAt) {
        RawValueParser.requireValid(listened);
        ProgressKey key = new ProgressKey(readerId, bookId, contextId);
        ZonedDateTime at = occurredAt == null ? now() : occurredAt;
        return progressLockRegistry.withLock(key, () -> progressUpdateService.logListening(key, listened, at));
    }

    public ProgressSnapshot markFinished(String readerId, String bookId, String contextId) {
        return markFinished(readerId, bookId, contextId, now());
    }

    public ProgressSnapshot markFinished(String readerId, String bookId, String contextId, ZonedDateTime occurredAt) {
        ProgressKey key = new ProgressKey(readerId, bookId, contextId);
        ZonedDateTime at = occurredAt == null ? now() : occurredAt;
        return progressLockRegistry.withLock(key, () -> progressUpdateService.markFinished(key, at));
    }

    public ProgressSnapshot activateFormat(ProgressKey key, MediumFormat medium, MediumSettings settings) {
        return progressLockRegistry.withLock(key, () -> progressUpdateService.activateFormat(key, medium, settings));
    }

    public ProgressSnapshot deactivateFormat(ProgressKey key, MediumFormat medium) {
        return progressLockRegistry.withLock(key, () -> progressUpdateService.deactivateFormat(key, medium));
    }

    public ProgressSnapshot updateSettings(ProgressKey key, Integer customTotalPages, BigDecimal audioPlaybackSpeed) {
        return progressLockRegistry.withLock(key,
                () -> progressUpdateService.updateSettings(key, customTotalPages, audioPlaybackSpeed));
    }

    public Optional<ProgressSnapshot> getProgress(String readerId, String bookId, String contextId) {
        return progressUpdateService.getProgress(new ProgressKey(readerId, bookId, contextId));
    }

    private ZonedDateTime now() {
        return ZonedDateTime.now(clock);
    }
}
