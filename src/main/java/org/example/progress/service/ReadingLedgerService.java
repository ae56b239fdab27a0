package org.example.progress.service;

import org.example.progress.entity.MediumFormat;
import org.example.progress.entity.ReadingLogEntity;
import org.example.progress.entity.ReadingProgressEntity;
import org.example.progress.repository.ReadingLogRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Append-only reading ledger. History is never edited: a later correction can
 * only add entries, so totals for past days never shrink.
 */
@Service
public class ReadingLedgerService {

    private final ReadingLogRepository readingLogRepository;

    public ReadingLedgerService(ReadingLogRepository readingLogRepository) {
        this.readingLogRepository = readingLogRepository;
    }

    @Transactional
    public ReadingLogEntity append(
            ReadingProgressEntity progress,
            LocalDate logDate,
            MediumFormat medium,
            BigDecimal pagesEquivalent,
            long audioSeconds) {
        if (progress == null || logDate == null || medium == null || pagesEquivalent == null) {
            throw new IllegalArgumentException("progress, logDate, medium and pagesEquivalent are required");
        }
        if (pagesEquivalent.signum() < 0 || audioSeconds < 0) {
            throw new IllegalArgumentException("Ledger contributions must not be negative");
        }
        ReadingLogEntity entry = new ReadingLogEntity(
                progress,
                logDate,
                medium,
                pagesEquivalent.setScale(PageEquivalenceConverter.SCALE, RoundingMode.HALF_UP),
                audioSeconds
        );
        return readingLogRepository.save(entry);
    }

    @Transactional(readOnly = true)
    public List<ReadingLogEntity> entriesFor(String progressId) {
        return readingLogRepository.findByProgress_IdOrderByLogDateAscRecordedAtAsc(progressId);
    }

    @Transactional(readOnly = true)
    public List<ReadingLogEntity> readerEntries(String readerId, LocalDate from, LocalDate to) {
        return readingLogRepository.findReaderEntriesBetween(readerId, from, to);
    }

    /**
     * Total page-equivalents and number of days with a positive contribution
     * for one progress record.
     */
    @Transactional(readOnly = true)
    public LedgerSummary summarize(String progressId) {
        if (progressId == null) {
            return LedgerSummary.EMPTY;
        }
        Map<LocalDate, BigDecimal> pagesByDay = new TreeMap<>();
        for (ReadingLogEntity entry : entriesFor(progressId)) {
            pagesByDay.merge(entry.getLogDate(), entry.getPagesEquivalent(), BigDecimal::add);
        }
        BigDecimal total = BigDecimal.ZERO.setScale(PageEquivalenceConverter.SCALE);
        int days = 0;
        for (BigDecimal pages : pagesByDay.values()) {
            if (pages.signum() > 0) {
                total = total.add(pages);
                days++;
            }
        }
        return new LedgerSummary(total, days);
    }

    public record LedgerSummary(
            BigDecimal totalPages,
            int readingDays
    ) {
        static final LedgerSummary EMPTY = new LedgerSummary(BigDecimal.ZERO.setScale(PageEquivalenceConverter.SCALE), 0);

        public BigDecimal averagePagesPerDay() {
            if (readingDays == 0 || totalPages.signum() == 0) {
                return null;
            }
            return totalPages.divide(BigDecimal.valueOf(readingDays), PageEquivalenceConverter.SCALE, RoundingMode.HALF_UP);
        }
    }
}
