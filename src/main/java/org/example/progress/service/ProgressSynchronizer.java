package org.example.progress.service;

import org.example.progress.config.ProgressEngineProperties;
import org.example.progress.entity.MediumFormat;
import org.example.progress.entity.ProgressMediumEntity;
import org.example.progress.entity.ReadingProgressEntity;
import org.example.progress.event.BookCompletedEvent;
import org.example.progress.event.ProgressAdvancedEvent;
import org.example.progress.model.SyncStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Applies a position change on one format to the whole progress record:
 * converts it to page-equivalents, appends the ledger delta, advances the
 * overall percent and drags the other active formats forward to match.
 * <p>
 * Callers own the transaction and the per-record lock; this class only
 * mutates the entities it is handed.
 */
@Component
public class ProgressSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(ProgressSynchronizer.class);

    private static final BigDecimal NO_PAGES = BigDecimal.ZERO.setScale(PageEquivalenceConverter.SCALE);

    private final PageEquivalenceConverter converter;
    private final ReadingLedgerService readingLedgerService;
    private final ApplicationEventPublisher eventPublisher;
    private final ProgressEngineProperties properties;

    public ProgressSynchronizer(
            PageEquivalenceConverter converter,
            ReadingLedgerService readingLedgerService,
            ApplicationEventPublisher eventPublisher,
            ProgressEngineProperties properties) {
        this.converter = converter;
        this.readingLedgerService = readingLedgerService;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
    }

    /**
     * @param referenceTotal  effective page count of the book, null when unknown
     * @param newRawValue     validated, non-negative position in the format's unit
     * @param listenedSeconds wall-clock listening time behind this update, when
     *                        the caller captured it; null for plain position reports
     */
    public SyncResult applyUpdate(
            ReadingProgressEntity progress,
            Integer referenceTotal,
            MediumFormat medium,
            BigDecimal newRawValue,
            ZonedDateTime occurredAt,
            Long listenedSeconds) {
        ProgressMediumEntity state = progress.findMedium(medium)
                .orElseThrow(() -> new NoActiveMediumException(medium));

        BigDecimal mediumTotal = mediumTotal(state, referenceTotal);
        BigDecimal clamped = mediumTotal == null ? newRawValue : newRawValue.min(mediumTotal);
        BigDecimal previousRaw = state.getRawPosition();
        state.setRawPosition(clamped);
        progress.setLastMedium(medium);

        Optional<BigDecimal> previousEquivalent = converter.toPagesEquivalent(medium, previousRaw, referenceTotal, mediumTotal);
        Optional<BigDecimal> newEquivalent = converter.toPagesEquivalent(medium, clamped, referenceTotal, mediumTotal);
        if (previousEquivalent.isEmpty() || newEquivalent.isEmpty()) {
            log.warn("No resolvable length for book {} ({}); stored position {} without equivalence",
                    progress.getBookId(), medium, clamped.toPlainString());
            return new SyncResult(SyncStatus.POSITION_ONLY, NO_PAGES);
        }

        BigDecimal previousPercent = progress.getPercent();
        BigDecimal newPercent = converter.toPercent(newEquivalent.get(), referenceTotal);
        BigDecimal delta = newEquivalent.get().subtract(previousEquivalent.get()).max(NO_PAGES);
        LocalDate logDate = occurredAt.toLocalDate();

        if (delta.signum() > 0) {
            long audioSeconds = 0;
            if (!medium.isPageBased()) {
                audioSeconds = listenedSeconds != null
                        ? listenedSeconds
                        : converter.wallClockSeconds(
                                clamped.subtract(previousRaw).longValueExact(),
                                effectivePlaybackSpeed(progress, state));
            }
            readingLedgerService.append(progress, logDate, medium, delta, audioSeconds);
        }

        projectOthers(progress, state, referenceTotal, newPercent);

        BigDecimal percent = previousPercent.max(newPercent);
        progress.setPercent(percent);
        progress.setCurrentPage(representativePage(referenceTotal, percent));

        log.debug("Synchronized {} for reader {} book {}: raw {} -> {}, delta {}, percent {} -> {}",
                medium, progress.getReaderId(), progress.getBookId(),
                previousRaw.toPlainString(), clamped.toPlainString(), delta, previousPercent, percent);

        if (delta.signum() > 0) {
            eventPublisher.publishEvent(new ProgressAdvancedEvent(
                    progress.getReaderId(),
                    progress.getBookId(),
                    contextIdOf(progress),
                    medium,
                    logDate,
                    delta,
                    percent
            ));
        }
        if (percent.compareTo(ReadingProgressEntity.COMPLETE_PERCENT) >= 0 && !progress.isComplete()) {
            markComplete(progress, occurredAt);
        }

        boolean changed = delta.signum() > 0
                || previousRaw.compareTo(clamped) != 0
                || percent.compareTo(previousPercent) != 0;
        return new SyncResult(changed ? SyncStatus.APPLIED : SyncStatus.UNCHANGED, delta);
    }

    /**
     * Forces the record to 100%. The equivalence still missing from the
     * overall position is written as one final ledger delta on the most
     * recently used format, and every format with a known length is moved
     * to its end.
     */
    public SyncResult finish(ReadingProgressEntity progress, Integer referenceTotal, ZonedDateTime occurredAt) {
        ProgressMediumEntity primary = primaryMedium(progress);
        BigDecimal delta = NO_PAGES;

        if (referenceTotal != null && referenceTotal > 0) {
            BigDecimal reference = BigDecimal.valueOf(referenceTotal);
            BigDecimal mediumTotal = mediumTotal(primary, referenceTotal);
            BigDecimal overall = reference.multiply(progress.getPercent())
                    .divide(new BigDecimal("100"), PageEquivalenceConverter.SCALE, RoundingMode.HALF_UP);
            BigDecimal covered = converter
                    .toPagesEquivalent(primary.getMedium(), primary.getRawPosition(), referenceTotal, mediumTotal)
                    .map(equivalent -> equivalent.max(overall))
                    .orElse(overall);
            delta = reference.subtract(covered).max(NO_PAGES).setScale(PageEquivalenceConverter.SCALE, RoundingMode.HALF_UP);
            if (delta.signum() > 0) {
                long audioSeconds = 0;
                if (!primary.getMedium().isPageBased() && mediumTotal != null) {
                    BigDecimal position = primary.getRawPosition().max(converter.projectRaw(mediumTotal, progress.getPercent()));
                    long remaining = mediumTotal.subtract(position).max(BigDecimal.ZERO).longValueExact();
                    audioSeconds = converter.wallClockSeconds(remaining, effectivePlaybackSpeed(progress, primary));
                }
                readingLedgerService.append(progress, occurredAt.toLocalDate(), primary.getMedium(), delta, audioSeconds);
                eventPublisher.publishEvent(new ProgressAdvancedEvent(
                        progress.getReaderId(),
                        progress.getBookId(),
                        contextIdOf(progress),
                        primary.getMedium(),
                        occurredAt.toLocalDate(),
                        delta,
                        ReadingProgressEntity.COMPLETE_PERCENT
                ));
            }
        }

        for (ProgressMediumEntity state : progress.getMedia()) {
            BigDecimal total = mediumTotal(state, referenceTotal);
            if (total != null && state.getRawPosition().compareTo(total) < 0) {
                state.setRawPosition(total);
            }
        }

        progress.setPercent(ReadingProgressEntity.COMPLETE_PERCENT);
        if (referenceTotal != null) {
            progress.setCurrentPage(referenceTotal);
        }
        progress.setLastMedium(primary.getMedium());
        markComplete(progress, occurredAt);
        return new SyncResult(SyncStatus.APPLIED, delta);
    }

    /**
     * Moves a single format forward to {@code percent}; never moves it back.
     */
    public void projectOnto(ProgressMediumEntity state, Integer referenceTotal, BigDecimal percent) {
        BigDecimal total = mediumTotal(state, referenceTotal);
        if (total == null || percent == null || percent.signum() <= 0) {
            return;
        }
        BigDecimal projected = converter.projectRaw(total, percent).min(total);
        if (projected.compareTo(state.getRawPosition()) > 0) {
            state.setRawPosition(projected);
        }
    }

    /**
     * Length of a format in its own unit: edition pages for paper and e-book,
     * recording seconds for audio. Null when unknown.
     */
    public BigDecimal mediumTotal(ProgressMediumEntity state, Integer referenceTotal) {
        if (state.getMedium().isPageBased()) {
            if (state.getTotalPagesOverride() != null) {
                return BigDecimal.valueOf(state.getTotalPagesOverride());
            }
            return referenceTotal == null ? null : BigDecimal.valueOf(referenceTotal);
        }
        return state.getAudioLengthSeconds() == null ? null : BigDecimal.valueOf(state.getAudioLengthSeconds());
    }

    public BigDecimal effectivePlaybackSpeed(ReadingProgressEntity progress, ProgressMediumEntity state) {
        if (state != null && state.getPlaybackSpeed() != null) {
            return state.getPlaybackSpeed();
        }
        if (progress.getAudioPlaybackSpeed() != null) {
            return progress.getAudioPlaybackSpeed();
        }
        return properties.getDefaultPlaybackSpeed();
    }

    private void projectOthers(
            ReadingProgressEntity progress,
            ProgressMediumEntity source,
            Integer referenceTotal,
            BigDecimal percent) {
        for (ProgressMediumEntity other : progress.getMedia()) {
            if (other != source) {
                projectOnto(other, referenceTotal, percent);
            }
        }
    }

    private ProgressMediumEntity primaryMedium(ReadingProgressEntity progress) {
        if (progress.getLastMedium() != null) {
            Optional<ProgressMediumEntity> last = progress.findMedium(progress.getLastMedium());
            if (last.isPresent()) {
                return last.get();
            }
        }
        return progress.getMedia().get(0);
    }

    private Integer representativePage(Integer referenceTotal, BigDecimal percent) {
        if (referenceTotal == null) {
            return null;
        }
        return converter.roundPages(BigDecimal.valueOf(referenceTotal)
                .multiply(percent)
                .divide(new BigDecimal("100"), PageEquivalenceConverter.SCALE, RoundingMode.HALF_UP));
    }

    private void markComplete(ReadingProgressEntity progress, ZonedDateTime occurredAt) {
        progress.setCompletedAt(occurredAt.toLocalDateTime());
        log.info("Progress {} completed: reader {} book {}", progress.getId(), progress.getReaderId(), progress.getBookId());
        eventPublisher.publishEvent(new BookCompletedEvent(
                progress.getReaderId(),
                progress.getBookId(),
                contextIdOf(progress),
                occurredAt
        ));
    }

    private String contextIdOf(ReadingProgressEntity progress) {
        return progress.getContextKey() == null || progress.getContextKey().isEmpty() ? null : progress.getContextKey();
    }

    public record SyncResult(
            SyncStatus status,
            BigDecimal ledgerDelta
    ) {
    }
}
