package org.example.progress.service;

import org.example.progress.config.ProgressEngineConfig;
import org.example.progress.entity.BookEntity;
import org.example.progress.entity.MediumFormat;
import org.example.progress.entity.ReadingLogEntity;
import org.example.progress.event.BookCompletedEvent;
import org.example.progress.model.MediumSettings;
import org.example.progress.model.ProgressKey;
import org.example.progress.model.ProgressSnapshot;
import org.example.progress.model.ReadingState;
import org.example.progress.model.SyncStatus;
import org.example.progress.repository.BookRepository;
import org.example.progress.repository.ReadingLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
@RecordApplicationEvents
@Import({
        ProgressEngineConfig.class,
        PageEquivalenceConverter.class,
        ReadingLedgerService.class,
        ProgressSynchronizer.class,
        ProgressUpdateService.class,
        ProgressLockRegistry.class,
        JpaBookCatalog.class,
        ReadingProgressService.class
})
class ReadingProgressServiceTest {

    private static final String READER = "reader-1";

    @Autowired
    private ReadingProgressService readingProgressService;

    @Autowired
    private BookRepository bookRepository;

    @Autowired
    private ReadingLogRepository readingLogRepository;

    @Autowired
    private ApplicationEvents events;

    private String novelId;
    private String audiobookId;

    @BeforeEach
    void setUp() {
        novelId = bookRepository.save(new BookEntity("Persuasion", "Jane Austen", 200)).getId();
        audiobookId = bookRepository.save(new BookEntity("Middlemarch", "George Eliot", 300)).getId();
    }

    @Test
    void reportProgress_paperReadOverThreeDays() {
        ProgressSnapshot dayOne = report(novelId, MediumFormat.PAPER, "50", day(1));
        assertEquals(new BigDecimal("50.00"), dayOne.ledgerDelta());
        assertEquals(new BigDecimal("25.00"), dayOne.percent());
        assertEquals(ReadingState.IN_PROGRESS, dayOne.state());

        ProgressSnapshot dayTwo = report(novelId, MediumFormat.PAPER, "100", day(2));
        assertEquals(new BigDecimal("50.00"), dayTwo.ledgerDelta());
        assertEquals(new BigDecimal("50.00"), dayTwo.percent());

        ProgressSnapshot dayThree = readingProgressService.markFinished(READER, novelId, null, day(3));
        assertEquals(new BigDecimal("100.00"), dayThree.ledgerDelta());
        assertEquals(new BigDecimal("100.00"), dayThree.percent());
        assertEquals(ReadingState.COMPLETE, dayThree.state());
        assertEquals(day(3).toLocalDateTime(), dayThree.completedAt());

        List<ReadingLogEntity> entries = readingLogRepository.findByProgress_IdOrderByLogDateAscRecordedAtAsc(dayThree.progressId());
        assertEquals(3, entries.size());
        assertEquals(LocalDate.of(2026, 3, 1), entries.get(0).getLogDate());
        assertEquals(new BigDecimal("50.00"), entries.get(0).getPagesEquivalent());
        assertEquals(LocalDate.of(2026, 3, 2), entries.get(1).getLogDate());
        assertEquals(new BigDecimal("50.00"), entries.get(1).getPagesEquivalent());
        assertEquals(LocalDate.of(2026, 3, 3), entries.get(2).getLogDate());
        assertEquals(new BigDecimal("100.00"), entries.get(2).getPagesEquivalent());
        assertEquals(MediumFormat.PAPER, entries.get(2).getMedium());
        assertEquals(1, events.stream(BookCompletedEvent.class).count());
    }

    @Test
    void reportProgress_audioPositionConvertsToPages() {
        ProgressKey key = ProgressKey.of(READER, audiobookId);
        readingProgressService.activateFormat(key, MediumFormat.AUDIO, MediumSettings.audio(Duration.ofHours(10), null));

        ProgressSnapshot snapshot = readingProgressService.reportProgress(
                READER, audiobookId, null, MediumFormat.AUDIO, new BigDecimal("18000"), day(1));

        assertEquals(new BigDecimal("150.00"), snapshot.ledgerDelta());
        assertEquals(new BigDecimal("50.00"), snapshot.percent());
        assertEquals(150, snapshot.currentPage());
        assertEquals(Duration.ofHours(5), snapshot.medium(MediumFormat.AUDIO).audioPosition());
    }

    @Test
    void reportProgress_acceptsAudioPositionAsClockTime() {
        ProgressKey key = ProgressKey.of(READER, audiobookId);
        readingProgressService.activateFormat(key, MediumFormat.AUDIO, MediumSettings.audio(Duration.ofHours(10), null));

        ProgressSnapshot snapshot = report(audiobookId, MediumFormat.AUDIO, "2:30:00", day(1));

        assertEquals(new BigDecimal("25.00"), snapshot.percent());
        assertEquals(Duration.ofMinutes(150), snapshot.medium(MediumFormat.AUDIO).audioPosition());
    }

    @Test
    void logListening_appliesPlaybackSpeedOnce() {
        ProgressKey key = ProgressKey.of(READER, audiobookId);
        ProgressSnapshot activated = readingProgressService.activateFormat(
                key, MediumFormat.AUDIO, MediumSettings.audio(Duration.ofHours(10), new BigDecimal("1.5")));
        assertEquals(Duration.ofMinutes(400), activated.medium(MediumFormat.AUDIO).adjustedAudioLength());

        ProgressSnapshot snapshot = readingProgressService.logListening(READER, audiobookId, null, Duration.ofHours(2), day(1));

        assertEquals(Duration.ofHours(3), snapshot.medium(MediumFormat.AUDIO).audioPosition());
        assertEquals(new BigDecimal("90.00"), snapshot.ledgerDelta());
        assertEquals(new BigDecimal("30.00"), snapshot.percent());
        ReadingLogEntity entry = readingLogRepository.findByProgress_IdOrderByLogDateAscRecordedAtAsc(snapshot.progressId()).get(0);
        assertEquals(7_200L, entry.getAudioSeconds());
    }

    @Test
    void activateFormat_projectsCurrentPercentOntoNewEdition() {
        report(novelId, MediumFormat.PAPER, "100", day(1));

        ProgressSnapshot snapshot = readingProgressService.activateFormat(
                ProgressKey.of(READER, novelId), MediumFormat.EBOOK, MediumSettings.pages(400));

        assertEquals(List.of(MediumFormat.PAPER, MediumFormat.EBOOK), snapshot.activeFormats());
        assertEquals(200, snapshot.medium(MediumFormat.EBOOK).currentPage());
        assertEquals(400, snapshot.medium(MediumFormat.EBOOK).totalPages());

        ProgressSnapshot fromEbook = report(novelId, MediumFormat.EBOOK, "300", day(2));
        assertEquals(new BigDecimal("50.00"), fromEbook.ledgerDelta());
        assertEquals(150, fromEbook.medium(MediumFormat.PAPER).currentPage());
    }

    @Test
    void markFinished_creditsOnlyPagesBeyondOverallPosition() {
        report(novelId, MediumFormat.PAPER, "100", day(1));
        readingProgressService.activateFormat(ProgressKey.of(READER, novelId), MediumFormat.EBOOK, MediumSettings.pages(400));
        ProgressSnapshot corrected = report(novelId, MediumFormat.EBOOK, "100", day(2));
        assertEquals(new BigDecimal("50.00"), corrected.percent());

        ProgressSnapshot finished = readingProgressService.markFinished(READER, novelId, null, day(3));

        assertEquals(new BigDecimal("100.00"), finished.ledgerDelta());
        BigDecimal ledgerTotal = readingLogRepository.findByProgress_IdOrderByLogDateAscRecordedAtAsc(finished.progressId())
                .stream()
                .map(ReadingLogEntity::getPagesEquivalent)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, new BigDecimal("200").compareTo(ledgerTotal));
        assertEquals(400, finished.medium(MediumFormat.EBOOK).currentPage());
    }

    @Test
    void reportProgress_replayAddsNothing() {
        report(novelId, MediumFormat.PAPER, "50", day(1));

        ProgressSnapshot replay = report(novelId, MediumFormat.PAPER, "50", day(1));

        assertEquals(SyncStatus.UNCHANGED, replay.status());
        assertEquals(0, replay.ledgerDelta().signum());
        assertEquals(1, readingLogRepository.countByProgress_Id(replay.progressId()));
    }

    @Test
    void reportProgress_clampsToEditionLength() {
        ProgressSnapshot snapshot = report(novelId, MediumFormat.PAPER, "500", day(1));

        assertEquals(200, snapshot.medium(MediumFormat.PAPER).currentPage());
        assertEquals(new BigDecimal("200.00"), snapshot.ledgerDelta());
        assertEquals(new BigDecimal("100.00"), snapshot.percent());
        assertEquals(ReadingState.COMPLETE, snapshot.state());
    }

    @Test
    void reportProgress_percentNeverDecreasesForAdvancingPages() {
        BigDecimal previous = BigDecimal.ZERO;
        for (String page : List.of("10", "10", "40", "90", "150", "199")) {
            ProgressSnapshot snapshot = report(novelId, MediumFormat.PAPER, page, day(1));
            assertTrue(snapshot.percent().compareTo(previous) >= 0);
            previous = snapshot.percent();
        }
        assertEquals(new BigDecimal("99.50"), previous);
    }

    @Test
    void reportProgress_unknownLengthKeepsPositionWithoutBackfill() {
        String unknownId = bookRepository.save(new BookEntity("Untitled", null, null)).getId();

        ProgressSnapshot positionOnly = report(unknownId, MediumFormat.PAPER, "42", day(1));
        assertEquals(SyncStatus.POSITION_ONLY, positionOnly.status());
        assertEquals(42, positionOnly.medium(MediumFormat.PAPER).currentPage());
        assertEquals(new BigDecimal("0.00"), positionOnly.percent());
        assertNull(positionOnly.totalPages());
        assertEquals(0, readingLogRepository.countByProgress_Id(positionOnly.progressId()));

        readingProgressService.updateSettings(ProgressKey.of(READER, unknownId), 100, null);
        ProgressSnapshot counted = report(unknownId, MediumFormat.PAPER, "60", day(2));

        assertEquals(SyncStatus.APPLIED, counted.status());
        assertEquals(new BigDecimal("18.00"), counted.ledgerDelta());
        assertEquals(new BigDecimal("60.00"), counted.percent());
    }

    @Test
    void reportProgress_inactiveFormatIsRejected() {
        report(novelId, MediumFormat.PAPER, "10", day(1));

        NoActiveMediumException error = assertThrows(NoActiveMediumException.class,
                () -> report(novelId, MediumFormat.EBOOK, "5", day(1)));

        assertEquals(ProgressFailureReason.NO_ACTIVE_MEDIUM, error.getReason());
    }

    @Test
    void reportProgress_afterFinishIsIdempotent() {
        report(novelId, MediumFormat.PAPER, "20", day(1));
        ProgressSnapshot finished = readingProgressService.markFinished(READER, novelId, null, day(2));

        ProgressSnapshot late = report(novelId, MediumFormat.PAPER, "30", day(3));
        ProgressSnapshot again = readingProgressService.markFinished(READER, novelId, null, day(4));

        assertEquals(SyncStatus.ALREADY_COMPLETE, late.status());
        assertEquals(SyncStatus.ALREADY_COMPLETE, again.status());
        assertEquals(finished.completedAt(), again.completedAt());
        assertEquals(2, readingLogRepository.countByProgress_Id(finished.progressId()));
        assertEquals(1, events.stream(BookCompletedEvent.class).count());
    }

    @Test
    void markFinished_unstartedBookCreditsWholeBook() {
        ProgressSnapshot snapshot = readingProgressService.markFinished(READER, novelId, null, day(1));

        assertEquals(ReadingState.COMPLETE, snapshot.state());
        assertEquals(List.of(MediumFormat.PAPER), snapshot.activeFormats());
        assertEquals(new BigDecimal("200.00"), snapshot.ledgerDelta());
        assertEquals(0, snapshot.pagesLeft());
    }

    @Test
    void reportProgress_invalidValueLeavesNoTrace() {
        InvalidRawValueException error = assertThrows(InvalidRawValueException.class,
                () -> readingProgressService.reportProgress(
                        READER, novelId, null, MediumFormat.PAPER, new BigDecimal("-3"), day(1)));

        assertEquals(ProgressFailureReason.INVALID_RAW_VALUE, error.getReason());
        assertTrue(readingProgressService.getProgress(READER, novelId, null).isEmpty());
    }

    @Test
    void getProgress_reportsInsights() {
        report(novelId, MediumFormat.PAPER, "50", day(1));
        report(novelId, MediumFormat.PAPER, "100", day(2));

        ProgressSnapshot snapshot = readingProgressService.getProgress(READER, novelId, "").orElseThrow();

        assertEquals(SyncStatus.UNCHANGED, snapshot.status());
        assertEquals(100, snapshot.pagesLeft());
        assertEquals(new BigDecimal("50.00"), snapshot.averagePagesPerDay());
        assertEquals(2, snapshot.estimatedDaysRemaining());
        assertEquals(200, snapshot.totalPages());
    }

    @Test
    void reportProgress_contextsTrackSeparateReadThroughs() {
        report(novelId, MediumFormat.PAPER, "120", day(1));

        ProgressSnapshot club = readingProgressService.reportProgress(
                READER, novelId, "book-club-7", MediumFormat.PAPER, "30", day(1));

        assertEquals("book-club-7", club.contextId());
        assertEquals(new BigDecimal("15.00"), club.percent());
        ProgressSnapshot solo = readingProgressService.getProgress(READER, novelId, null).orElseThrow();
        assertNotEquals(solo.progressId(), club.progressId());
        assertEquals(new BigDecimal("60.00"), solo.percent());
        assertNull(solo.contextId());
    }

    @Test
    void deactivateFormat_keepsAtLeastOneFormat() {
        report(novelId, MediumFormat.PAPER, "10", day(1));
        ProgressKey key = ProgressKey.of(READER, novelId);

        ProgressException error = assertThrows(ProgressException.class,
                () -> readingProgressService.deactivateFormat(key, MediumFormat.PAPER));

        assertEquals(ProgressFailureReason.LAST_ACTIVE_MEDIUM, error.getReason());
    }

    @Test
    void deactivateFormat_keepsLedgerHistory() {
        report(novelId, MediumFormat.PAPER, "10", day(1));
        ProgressKey key = ProgressKey.of(READER, novelId);
        readingProgressService.activateFormat(key, MediumFormat.EBOOK, MediumSettings.none());

        ProgressSnapshot snapshot = readingProgressService.deactivateFormat(key, MediumFormat.PAPER);

        assertEquals(List.of(MediumFormat.EBOOK), snapshot.activeFormats());
        assertEquals(1, readingLogRepository.countByProgress_Id(snapshot.progressId()));
        assertEquals(new BigDecimal("5.00"), snapshot.percent());
    }

    @Test
    void activateFormat_rejectsUnsupportedSettings() {
        ProgressKey key = ProgressKey.of(READER, audiobookId);

        ProgressException speed = assertThrows(ProgressException.class, () -> readingProgressService.activateFormat(
                key, MediumFormat.AUDIO, MediumSettings.audio(Duration.ofHours(1), new BigDecimal("4.0"))));
        ProgressException pages = assertThrows(ProgressException.class, () -> readingProgressService.activateFormat(
                key, MediumFormat.PAPER, MediumSettings.pages(0)));

        assertEquals(ProgressFailureReason.INVALID_SETTING, speed.getReason());
        assertEquals(ProgressFailureReason.INVALID_SETTING, pages.getReason());
        assertTrue(readingProgressService.getProgress(READER, audiobookId, null).isEmpty());
    }

    @Test
    void updateSettings_requiresExistingRecord() {
        ProgressException error = assertThrows(ProgressException.class,
                () -> readingProgressService.updateSettings(ProgressKey.of(READER, novelId), 150, null));

        assertEquals(ProgressFailureReason.PROGRESS_NOT_FOUND, error.getReason());
    }

    @Test
    void updateSettings_recordSpeedAppliesToListening() {
        ProgressKey key = ProgressKey.of(READER, audiobookId);
        readingProgressService.activateFormat(key, MediumFormat.AUDIO, MediumSettings.audio(Duration.ofHours(10), null));
        ProgressSnapshot updated = readingProgressService.updateSettings(key, null, new BigDecimal("2.0"));
        assertNotNull(updated.medium(MediumFormat.AUDIO));

        ProgressSnapshot snapshot = readingProgressService.logListening(READER, audiobookId, null, Duration.ofHours(1), day(1));

        assertEquals(Duration.ofHours(2), snapshot.medium(MediumFormat.AUDIO).audioPosition());
        assertEquals(new BigDecimal("20.00"), snapshot.percent());
    }

    private ProgressSnapshot report(String bookId, MediumFormat medium, String rawValue, ZonedDateTime occurredAt) {
        return readingProgressService.reportProgress(READER, bookId, null, medium, rawValue, occurredAt);
    }

    private static ZonedDateTime day(int dayOfMonth) {
        return ZonedDateTime.of(2026, 3, dayOfMonth, 21, 0, 0, 0, ZoneOffset.UTC);
    }
}
