package org.example.progress.service;

import org.example.progress.entity.MediumFormat;
import org.example.progress.entity.ReadingLogEntity;
import org.example.progress.entity.ReadingProgressEntity;
import org.example.progress.model.BestDay;
import org.example.progress.model.CalendarDay;
import org.example.progress.model.DateSpan;
import org.example.progress.model.DayTotal;
import org.example.progress.model.FormatShare;
import org.example.progress.model.MediumTotal;
import org.example.progress.model.PeriodSummary;
import org.example.progress.model.ReadingCalendar;
import org.example.progress.model.StatsPeriod;
import org.example.progress.model.StreakSummary;
import org.example.progress.repository.ReadingProgressRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-side statistics. Every figure is recomputed from the reading ledger and
 * the completion timestamps of progress records; nothing is cached here.
 */
@Service
@Transactional(readOnly = true)
public class ReadingStatisticsService {

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final BigDecimal NO_PAGES = BigDecimal.ZERO.setScale(PageEquivalenceConverter.SCALE);
    private static final int RECENT_DAYS = 7;

    private final ReadingLedgerService readingLedgerService;
    private final ReadingProgressRepository readingProgressRepository;

    public ReadingStatisticsService(
            ReadingLedgerService readingLedgerService,
            ReadingProgressRepository readingProgressRepository) {
        this.readingLedgerService = readingLedgerService;
        this.readingProgressRepository = readingProgressRepository;
    }

    /**
     * Days in {@code [from, to]} that have at least one ledger entry, in date order.
     */
    public List<DayTotal> getDailyTotals(String readerId, LocalDate from, LocalDate to) {
        requireRange(readerId, from, to);
        Map<LocalDate, DayAccumulator> days = new TreeMap<>();
        for (ReadingLogEntity entry : readingLedgerService.readerEntries(readerId, from, to)) {
            days.computeIfAbsent(entry.getLogDate(), DayAccumulator::new).add(entry);
        }
        List<DayTotal> totals = new ArrayList<>(days.size());
        for (DayAccumulator day : days.values()) {
            totals.add(day.toDayTotal());
        }
        return totals;
    }

    public PeriodSummary getPeriodSummary(String readerId, StatsPeriod period, LocalDate anchor) {
        if (period == null || period == StatsPeriod.CUSTOM) {
            throw new IllegalArgumentException("A fixed period is required; use an explicit range for custom periods");
        }
        if (anchor == null) {
            throw new IllegalArgumentException("anchor is required");
        }
        LocalDate from;
        LocalDate to;
        switch (period) {
            case DAY -> {
                from = anchor;
                to = anchor;
            }
            case WEEK -> {
                from = anchor.minusDays(RECENT_DAYS - 1L);
                to = anchor;
            }
            case MONTH -> {
                from = anchor.withDayOfMonth(1);
                to = YearMonth.from(anchor).atEndOfMonth();
            }
            default -> {
                from = anchor.withDayOfYear(1);
                to = anchor.withDayOfYear(anchor.lengthOfYear());
            }
        }
        return summarize(readerId, period, from, to);
    }

    public PeriodSummary getPeriodSummary(String readerId, LocalDate from, LocalDate to) {
        return summarize(readerId, StatsPeriod.CUSTOM, from, to);
    }

    public ReadingCalendar getCalendar(String readerId, int year, int month) {
        YearMonth yearMonth;
        try {
            yearMonth = YearMonth.of(year, month);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid month: " + year + "-" + month, e);
        }
        LocalDate from = yearMonth.atDay(1);
        LocalDate to = yearMonth.atEndOfMonth();

        Map<LocalDate, DayTotal> totals = new TreeMap<>();
        for (DayTotal total : getDailyTotals(readerId, from, to)) {
            totals.put(total.date(), total);
        }
        Map<LocalDate, Set<String>> completions = new TreeMap<>();
        for (ReadingProgressEntity progress : completedBetween(readerId, from, to)) {
            completions.computeIfAbsent(progress.getCompletedAt().toLocalDate(), ignored -> new TreeSet<>())
                    .add(progress.getBookId());
        }

        List<CalendarDay> days = new ArrayList<>(yearMonth.lengthOfMonth());
        boolean hasActivity = !completions.isEmpty();
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            DayTotal total = totals.get(date);
            Set<String> completed = completions.getOrDefault(date, Collections.emptySet());
            CalendarDay day = new CalendarDay(
                    date,
                    total == null ? NO_PAGES : total.pages(),
                    total == null ? 0 : ceilMinutes(total.audioSeconds()),
                    total == null ? List.of() : total.bookIds(),
                    List.copyOf(completed),
                    !completed.isEmpty()
            );
            hasActivity = hasActivity || day.hasActivity();
            days.add(day);
        }
        return new ReadingCalendar(
                yearMonth,
                List.copyOf(days),
                hasActivity,
                yearMonth.minusMonths(1),
                yearMonth.plusMonths(1)
        );
    }

    /**
     * Longest reading streak and longest gap inside {@code [from, to]}, plus the
     * streak that ends on {@code to}. A reading day is a day with a positive
     * page-equivalent total.
     */
    public StreakSummary getStreaks(String readerId, LocalDate from, LocalDate to) {
        Set<LocalDate> readingDays = new TreeSet<>();
        for (DayTotal total : getDailyTotals(readerId, from, to)) {
            if (total.pages().signum() > 0) {
                readingDays.add(total.date());
            }
        }

        DateSpan longestStreak = null;
        DateSpan longestGap = null;
        LocalDate runStart = from;
        boolean runReading = readingDays.contains(from);
        for (LocalDate date = from; !date.isAfter(to.plusDays(1)); date = date.plusDays(1)) {
            boolean reading = !date.isAfter(to) && readingDays.contains(date);
            if (date.isAfter(to) || reading != runReading) {
                DateSpan run = span(runStart, date.minusDays(1));
                if (runReading) {
                    longestStreak = longer(longestStreak, run);
                } else {
                    longestGap = longer(longestGap, run);
                }
                runStart = date;
                runReading = reading;
            }
        }

        int currentStreak = 0;
        for (LocalDate date = to; !date.isBefore(from) && readingDays.contains(date); date = date.minusDays(1)) {
            currentStreak++;
        }
        return new StreakSummary(from, to, longestStreak, longestGap, currentStreak);
    }

    /**
     * The seven days ending at {@code anchor}, including days without reading.
     */
    public List<DayTotal> getRecentActivity(String readerId, LocalDate anchor) {
        if (anchor == null) {
            throw new IllegalArgumentException("anchor is required");
        }
        LocalDate from = anchor.minusDays(RECENT_DAYS - 1L);
        Map<LocalDate, DayTotal> totals = new TreeMap<>();
        for (DayTotal total : getDailyTotals(readerId, from, anchor)) {
            totals.put(total.date(), total);
        }
        List<DayTotal> recent = new ArrayList<>(RECENT_DAYS);
        for (LocalDate date = from; !date.isAfter(anchor); date = date.plusDays(1)) {
            DayTotal total = totals.get(date);
            recent.add(total != null ? total : new DayTotal(date, NO_PAGES, 0, Map.of(), Map.of(), List.of()));
        }
        return recent;
    }

    private PeriodSummary summarize(String readerId, StatsPeriod period, LocalDate from, LocalDate to) {
        List<DayTotal> totals = getDailyTotals(readerId, from, to);

        BigDecimal totalPages = NO_PAGES;
        long audioSeconds = 0;
        int readingDays = 0;
        BestDay bestDay = null;
        Map<MediumFormat, BigDecimal> pagesByFormat = new EnumMap<>(MediumFormat.class);
        Map<String, MediumTotal> byBook = new TreeMap<>();
        for (DayTotal total : totals) {
            totalPages = totalPages.add(total.pages());
            audioSeconds += total.audioSeconds();
            if (total.pages().signum() > 0) {
                readingDays++;
                if (bestDay == null || total.pages().compareTo(bestDay.pages()) > 0) {
                    bestDay = new BestDay(total.date(), total.pages());
                }
            }
            for (Map.Entry<MediumFormat, MediumTotal> medium : total.byMedium().entrySet()) {
                pagesByFormat.merge(medium.getKey(), medium.getValue().pages(), BigDecimal::add);
            }
            for (Map.Entry<String, MediumTotal> book : total.byBook().entrySet()) {
                byBook.merge(book.getKey(), book.getValue(), ReadingStatisticsService::sum);
            }
        }

        BigDecimal average = readingDays == 0
                ? NO_PAGES
                : totalPages.divide(BigDecimal.valueOf(readingDays), PageEquivalenceConverter.SCALE, RoundingMode.HALF_UP);

        List<FormatShare> shares = new ArrayList<>();
        if (totalPages.signum() > 0) {
            for (Map.Entry<MediumFormat, BigDecimal> entry : pagesByFormat.entrySet()) {
                if (entry.getValue().signum() > 0) {
                    BigDecimal percent = entry.getValue()
                            .multiply(HUNDRED)
                            .divide(totalPages, PageEquivalenceConverter.SCALE, RoundingMode.HALF_UP);
                    shares.add(new FormatShare(entry.getKey(), entry.getValue(), percent));
                }
            }
        }

        int booksCompleted = completedBetween(readerId, from, to).size();
        return new PeriodSummary(
                period,
                from,
                to,
                totalPages,
                audioSeconds,
                readingDays,
                average,
                bestDay,
                booksCompleted,
                List.copyOf(shares),
                Collections.unmodifiableMap(byBook)
        );
    }

    private List<ReadingProgressEntity> completedBetween(String readerId, LocalDate from, LocalDate to) {
        return readingProgressRepository.findCompletedBetween(
                readerId, from.atStartOfDay(), to.plusDays(1).atStartOfDay());
    }

    private static void requireRange(String readerId, LocalDate from, LocalDate to) {
        if (readerId == null || readerId.isBlank()) {
            throw new IllegalArgumentException("readerId is required");
        }
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to are required");
        }
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to: " + from + " > " + to);
        }
    }

    private static MediumTotal sum(MediumTotal left, MediumTotal right) {
        return new MediumTotal(left.pages().add(right.pages()), left.audioSeconds() + right.audioSeconds());
    }

    private static long ceilMinutes(long seconds) {
        return (seconds + 59) / 60;
    }

    private static DateSpan span(LocalDate start, LocalDate end) {
        return new DateSpan(start, end, (int) ChronoUnit.DAYS.between(start, end) + 1);
    }

    private static DateSpan longer(DateSpan current, DateSpan candidate) {
        return current == null || candidate.days() > current.days() ? candidate : current;
    }

    private static final class DayAccumulator {

        private final LocalDate date;
        private final Map<MediumFormat, BigDecimal> pages = new EnumMap<>(MediumFormat.class);
        private final Map<MediumFormat, Long> audioSeconds = new EnumMap<>(MediumFormat.class);
        private final Map<String, MediumTotal> byBook = new TreeMap<>();

        private DayAccumulator(LocalDate date) {
            this.date = date;
        }

        private void add(ReadingLogEntity entry) {
            pages.merge(entry.getMedium(), entry.getPagesEquivalent(), BigDecimal::add);
            audioSeconds.merge(entry.getMedium(), entry.getAudioSeconds(), Long::sum);
            byBook.merge(entry.getProgress().getBookId(),
                    new MediumTotal(entry.getPagesEquivalent(), entry.getAudioSeconds()),
                    ReadingStatisticsService::sum);
        }

        private DayTotal toDayTotal() {
            BigDecimal totalPages = NO_PAGES;
            long totalAudio = 0;
            Map<MediumFormat, MediumTotal> byMedium = new EnumMap<>(MediumFormat.class);
            for (Map.Entry<MediumFormat, BigDecimal> entry : pages.entrySet()) {
                long seconds = audioSeconds.getOrDefault(entry.getKey(), 0L);
                byMedium.put(entry.getKey(), new MediumTotal(entry.getValue(), seconds));
                totalPages = totalPages.add(entry.getValue());
                totalAudio += seconds;
            }
            return new DayTotal(
                    date,
                    totalPages,
                    totalAudio,
                    Collections.unmodifiableMap(byMedium),
                    Collections.unmodifiableMap(byBook),
                    List.copyOf(byBook.keySet())
            );
        }
    }
}
