package org.example.progress.service;

import org.example.progress.config.ProgressEngineProperties;
import org.example.progress.entity.MediumFormat;
import org.example.progress.entity.ProgressMediumEntity;
import org.example.progress.entity.ReadingProgressEntity;
import org.example.progress.model.MediumSettings;
import org.example.progress.model.MediumSnapshot;
import org.example.progress.model.ProgressKey;
import org.example.progress.model.ProgressSnapshot;
import org.example.progress.model.ReadingState;
import org.example.progress.model.SyncStatus;
import org.example.progress.repository.ReadingProgressRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Transactional unit of work for every progress mutation: load (or lazily
 * create) the record under a row lock, validate, synchronize, persist.
 * Validation always runs before the first mutation.
 */
@Service
public class ProgressUpdateService {

    private static final Logger log = LoggerFactory.getLogger(ProgressUpdateService.class);

    private static final BigDecimal NO_PAGES = BigDecimal.ZERO.setScale(PageEquivalenceConverter.SCALE);

    private final ReadingProgressRepository readingProgressRepository;
    private final BookCatalog bookCatalog;
    private final PageEquivalenceConverter converter;
    private final ProgressSynchronizer progressSynchronizer;
    private final ReadingLedgerService readingLedgerService;
    private final ProgressEngineProperties properties;

    public ProgressUpdateService(
            ReadingProgressRepository readingProgressRepository,
            BookCatalog bookCatalog,
            PageEquivalenceConverter converter,
            ProgressSynchronizer progressSynchronizer,
            ReadingLedgerService readingLedgerService,
            ProgressEngineProperties properties) {
        this.readingProgressRepository = readingProgressRepository;
        this.bookCatalog = bookCatalog;
        this.converter = converter;
        this.progressSynchronizer = progressSynchronizer;
        this.readingLedgerService = readingLedgerService;
        this.properties = properties;
    }

    @Transactional
    public ProgressSnapshot report(ProgressKey key, MediumFormat medium, BigDecimal rawValue, ZonedDateTime occurredAt) {
        BigDecimal validated = RawValueParser.requireValid(medium, rawValue);
        requireTimestamp(occurredAt);

        ReadingProgressEntity progress = loadOrCreate(key, medium);
        if (progress.isComplete()) {
            return toSnapshot(progress, SyncStatus.ALREADY_COMPLETE, NO_PAGES);
        }
        if (!progress.isActive(medium)) {
            throw new NoActiveMediumException(medium);
        }

        ProgressSynchronizer.SyncResult result = progressSynchronizer.applyUpdate(
                progress, referenceTotal(progress), medium, validated, occurredAt, null);
        ReadingProgressEntity saved = readingProgressRepository.save(progress);
        return toSnapshot(saved, result.status(), result.ledgerDelta());
    }

    /**
     * Advances the audio position by {@code listened} wall-clock time scaled by
     * the playback speed; the scaling happens here and nowhere else.
     */
    @Transactional
    public ProgressSnapshot logListening(ProgressKey key, Duration listened, ZonedDateTime occurredAt) {
        RawValueParser.requireValid(listened);
        requireTimestamp(occurredAt);

        ReadingProgressEntity progress = loadOrCreate(key, MediumFormat.AUDIO);
        if (progress.isComplete()) {
            return toSnapshot(progress, SyncStatus.ALREADY_COMPLETE, NO_PAGES);
        }
        ProgressMediumEntity audio = progress.findMedium(MediumFormat.AUDIO)
                .orElseThrow(() -> new NoActiveMediumException(MediumFormat.AUDIO));

        long listenedSeconds = listened.getSeconds();
        BigDecimal speed = progressSynchronizer.effectivePlaybackSpeed(progress, audio);
        long adjusted = converter.adjustForSpeed(listenedSeconds, speed);
        BigDecimal newPosition = audio.getRawPosition().add(BigDecimal.valueOf(adjusted));

        ProgressSynchronizer.SyncResult result = progressSynchronizer.applyUpdate(
                progress, referenceTotal(progress), MediumFormat.AUDIO, newPosition, occurredAt, listenedSeconds);
        ReadingProgressEntity saved = readingProgressRepository.save(progress);
        return toSnapshot(saved, result.status(), result.ledgerDelta());
    }

    @Transactional
    public ProgressSnapshot markFinished(ProgressKey key, ZonedDateTime occurredAt) {
        requireTimestamp(occurredAt);
        ReadingProgressEntity progress = loadOrCreate(key, MediumFormat.PAPER);
        if (progress.isComplete()) {
            return toSnapshot(progress, SyncStatus.ALREADY_COMPLETE, NO_PAGES);
        }
        ProgressSynchronizer.SyncResult result = progressSynchronizer.finish(progress, referenceTotal(progress), occurredAt);
        ReadingProgressEntity saved = readingProgressRepository.save(progress);
        return toSnapshot(saved, result.status(), result.ledgerDelta());
    }

    @Transactional
    public ProgressSnapshot activateFormat(ProgressKey key, MediumFormat medium, MediumSettings settings) {
        if (medium == null) {
            throw new ProgressException(ProgressFailureReason.INVALID_SETTING, "Format is required");
        }
        MediumSettings requested = settings == null ? MediumSettings.none() : settings;
        validateSettings(medium, requested);

        ReadingProgressEntity progress = loadOrCreate(key, medium);
        Integer referenceTotal = referenceTotal(progress);
        Optional<ProgressMediumEntity> existing = progress.findMedium(medium);
        ProgressMediumEntity state;
        if (existing.isPresent()) {
            state = existing.get();
            applySettings(state, requested);
            clampToTotal(state, referenceTotal);
        } else {
            state = new ProgressMediumEntity(medium);
            applySettings(state, requested);
            progress.addMedium(state);
            log.info("Activated {} for reader {} book {}", medium, key.readerId(), key.bookId());
        }
        progressSynchronizer.projectOnto(state, referenceTotal, progress.getPercent());

        ReadingProgressEntity saved = readingProgressRepository.save(progress);
        return toSnapshot(saved, SyncStatus.APPLIED, NO_PAGES);
    }

    @Transactional
    public ProgressSnapshot deactivateFormat(ProgressKey key, MediumFormat medium) {
        ReadingProgressEntity progress = loadExisting(key);
        ProgressMediumEntity state = progress.findMedium(medium)
                .orElseThrow(() -> new NoActiveMediumException(medium));
        if (progress.getMedia().size() == 1) {
            throw new ProgressException(ProgressFailureReason.LAST_ACTIVE_MEDIUM,
                    "At least one format must stay active");
        }
        progress.removeMedium(state);
        if (progress.getLastMedium() == medium) {
            progress.setLastMedium(null);
        }
        log.info("Deactivated {} for reader {} book {}", medium, key.readerId(), key.bookId());

        ReadingProgressEntity saved = readingProgressRepository.save(progress);
        return toSnapshot(saved, SyncStatus.APPLIED, NO_PAGES);
    }

    /**
     * Updates record-level settings. A new page count changes how future
     * updates are measured; the overall percent never moves back.
     */
    @Transactional
    public ProgressSnapshot updateSettings(ProgressKey key, Integer customTotalPages, BigDecimal audioPlaybackSpeed) {
        if (customTotalPages != null && customTotalPages <= 0) {
            throw new ProgressException(ProgressFailureReason.INVALID_SETTING,
                    "Total pages must be positive: " + customTotalPages);
        }
        validateSpeed(audioPlaybackSpeed);

        ReadingProgressEntity progress = loadExisting(key);
        if (customTotalPages != null) {
            progress.setCustomTotalPages(customTotalPages);
        }
        if (audioPlaybackSpeed != null) {
            progress.setAudioPlaybackSpeed(audioPlaybackSpeed.setScale(1, RoundingMode.HALF_UP));
        }
        Integer referenceTotal = referenceTotal(progress);
        for (ProgressMediumEntity state : progress.getMedia()) {
            clampToTotal(state, referenceTotal);
        }
        if (referenceTotal != null) {
            progress.setCurrentPage(converter.roundPages(BigDecimal.valueOf(referenceTotal)
                    .multiply(progress.getPercent())
                    .divide(new BigDecimal("100"), PageEquivalenceConverter.SCALE, RoundingMode.HALF_UP)));
        }

        ReadingProgressEntity saved = readingProgressRepository.save(progress);
        return toSnapshot(saved, SyncStatus.APPLIED, NO_PAGES);
    }

    @Transactional(readOnly = true)
    public Optional<ProgressSnapshot> getProgress(ProgressKey key) {
        return readingProgressRepository
                .findByReaderIdAndBookIdAndContextKey(key.readerId(), key.bookId(), key.contextKey())
                .map(progress -> toSnapshot(progress, SyncStatus.UNCHANGED, NO_PAGES));
    }

    private ReadingProgressEntity loadOrCreate(ProgressKey key, MediumFormat initialMedium) {
        return readingProgressRepository
                .findForUpdate(key.readerId(), key.bookId(), key.contextKey())
                .orElseGet(() -> {
                    ReadingProgressEntity created = new ReadingProgressEntity(key.readerId(), key.bookId(), key.contextKey());
                    created.addMedium(new ProgressMediumEntity(initialMedium));
                    log.info("Started tracking book {} for reader {} with {}", key.bookId(), key.readerId(), initialMedium);
                    return readingProgressRepository.saveAndFlush(created);
                });
    }

    private ReadingProgressEntity loadExisting(ProgressKey key) {
        return readingProgressRepository
                .findForUpdate(key.readerId(), key.bookId(), key.contextKey())
                .orElseThrow(() -> new ProgressException(ProgressFailureReason.PROGRESS_NOT_FOUND,
                        "No progress for book " + key.bookId()));
    }

    private Integer referenceTotal(ReadingProgressEntity progress) {
        if (progress.getCustomTotalPages() != null && progress.getCustomTotalPages() > 0) {
            return progress.getCustomTotalPages();
        }
        return bookCatalog.getEffectiveTotalPages(progress.getBookId()).orElse(null);
    }

    private void validateSettings(MediumFormat medium, MediumSettings settings) {
        if (settings.totalPagesOverride() != null) {
            if (!medium.isPageBased()) {
                throw new ProgressException(ProgressFailureReason.INVALID_SETTING,
                        "Page count does not apply to " + medium);
            }
            if (settings.totalPagesOverride() <= 0) {
                throw new ProgressException(ProgressFailureReason.INVALID_SETTING,
                        "Total pages must be positive: " + settings.totalPagesOverride());
            }
        }
        if (settings.audioLength() != null || settings.playbackSpeed() != null) {
            if (medium.isPageBased()) {
                throw new ProgressException(ProgressFailureReason.INVALID_SETTING,
                        "Audio settings do not apply to " + medium);
            }
        }
        if (settings.audioLength() != null
                && (settings.audioLength().isNegative() || settings.audioLength().isZero())) {
            throw new ProgressException(ProgressFailureReason.INVALID_SETTING,
                    "Audio length must be positive: " + settings.audioLength());
        }
        validateSpeed(settings.playbackSpeed());
    }

    private void validateSpeed(BigDecimal speed) {
        if (speed != null && !properties.isSupportedPlaybackSpeed(speed)) {
            throw new ProgressException(ProgressFailureReason.INVALID_SETTING,
                    "Playback speed must be between " + properties.getMinPlaybackSpeed()
                            + " and " + properties.getMaxPlaybackSpeed() + ": " + speed);
        }
    }

    private void applySettings(ProgressMediumEntity state, MediumSettings settings) {
        if (settings.totalPagesOverride() != null) {
            state.setTotalPagesOverride(settings.totalPagesOverride());
        }
        if (settings.audioLength() != null) {
            state.setAudioLengthSeconds(settings.audioLength().getSeconds());
        }
        if (settings.playbackSpeed() != null) {
            state.setPlaybackSpeed(settings.playbackSpeed().setScale(1, RoundingMode.HALF_UP));
        }
    }

    private void clampToTotal(ProgressMediumEntity state, Integer referenceTotal) {
        BigDecimal total = progressSynchronizer.mediumTotal(state, referenceTotal);
        if (total != null && state.getRawPosition().compareTo(total) > 0) {
            state.setRawPosition(total);
        }
    }

    private void requireTimestamp(ZonedDateTime occurredAt) {
        if (occurredAt == null) {
            throw new InvalidRawValueException("Timestamp is required");
        }
    }

    private ProgressSnapshot toSnapshot(ReadingProgressEntity progress, SyncStatus status, BigDecimal ledgerDelta) {
        Integer referenceTotal = referenceTotal(progress);
        ReadingLedgerService.LedgerSummary summary = readingLedgerService.summarize(progress.getId());

        Integer pagesLeft = null;
        if (referenceTotal != null) {
            int current = progress.getCurrentPage() == null ? 0 : progress.getCurrentPage();
            pagesLeft = progress.isComplete() ? 0 : Math.max(0, referenceTotal - current);
        }
        BigDecimal average = summary.averagePagesPerDay();
        Integer daysRemaining = null;
        if (pagesLeft != null && pagesLeft == 0) {
            daysRemaining = 0;
        } else if (pagesLeft != null && average != null && average.signum() > 0) {
            daysRemaining = Math.max(1, BigDecimal.valueOf(pagesLeft)
                    .divide(average, 0, RoundingMode.CEILING)
                    .intValueExact());
        }

        List<MediumSnapshot> media = progress.getMedia().stream()
                .map(state -> toMediumSnapshot(progress, state, referenceTotal))
                .toList();

        return new ProgressSnapshot(
                progress.getId(),
                progress.getReaderId(),
                progress.getBookId(),
                progress.getContextKey().isEmpty() ? null : progress.getContextKey(),
                progress.isComplete() ? ReadingState.COMPLETE : ReadingState.IN_PROGRESS,
                status,
                progress.getPercent(),
                progress.getCurrentPage(),
                referenceTotal,
                progress.getActiveFormats(),
                media,
                ledgerDelta,
                pagesLeft,
                average,
                daysRemaining,
                progress.getCompletedAt()
        );
    }

    private MediumSnapshot toMediumSnapshot(ReadingProgressEntity progress, ProgressMediumEntity state, Integer referenceTotal) {
        BigDecimal total = progressSynchronizer.mediumTotal(state, referenceTotal);
        if (state.getMedium().isPageBased()) {
            return new MediumSnapshot(
                    state.getMedium(),
                    state.getCurrentPage() == null ? 0 : state.getCurrentPage(),
                    total == null ? null : total.intValueExact(),
                    null,
                    null,
                    null,
                    null
            );
        }
        BigDecimal speed = progressSynchronizer.effectivePlaybackSpeed(progress, state);
        Duration length = state.getAudioLengthSeconds() == null ? null : Duration.ofSeconds(state.getAudioLengthSeconds());
        Duration adjusted = length == null
                ? null
                : Duration.ofSeconds(converter.wallClockSeconds(length.getSeconds(), speed));
        return new MediumSnapshot(
                state.getMedium(),
                null,
                null,
                Duration.ofSeconds(state.getAudioPositionSeconds() == null ? 0 : state.getAudioPositionSeconds()),
                length,
                speed,
                adjusted
        );
    }
}
