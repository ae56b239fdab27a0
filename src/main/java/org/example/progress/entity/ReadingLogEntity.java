package org.example.progress.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One incremental contribution to a reader's history. Rows are insert-only:
 * several entries for the same progress, day and medium are summed on read.
 */
@Entity
@Table(
        name = "reading_log",
        indexes = {
                @Index(name = "idx_reading_log_progress_date", columnList = "progress_id, log_date")
        }
)
public class ReadingLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "progress_id", nullable = false, updatable = false)
    private ReadingProgressEntity progress;

    @Column(name = "log_date", nullable = false, updatable = false)
    private LocalDate logDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private MediumFormat medium;

    @Column(name = "pages_equivalent", nullable = false, precision = 9, scale = 2, updatable = false)
    private BigDecimal pagesEquivalent;

    @Column(name = "audio_seconds", nullable = false, updatable = false)
    private long audioSeconds;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private LocalDateTime recordedAt;

    protected ReadingLogEntity() {
    }

    public ReadingLogEntity(
            ReadingProgressEntity progress,
            LocalDate logDate,
            MediumFormat medium,
            BigDecimal pagesEquivalent,
            long audioSeconds) {
        this.progress = progress;
        this.logDate = logDate;
        this.medium = medium;
        this.pagesEquivalent = pagesEquivalent;
        this.audioSeconds = audioSeconds;
    }

    @PrePersist
    void onCreate() {
        if (recordedAt == null) {
            recordedAt = LocalDateTime.now();
        }
    }

    public String getId() {
        return id;
    }

    public ReadingProgressEntity getProgress() {
        return progress;
    }

    public LocalDate getLogDate() {
        return logDate;
    }

    public MediumFormat getMedium() {
        return medium;
    }

    public BigDecimal getPagesEquivalent() {
        return pagesEquivalent;
    }

    public long getAudioSeconds() {
        return audioSeconds;
    }

    public LocalDateTime getRecordedAt() {
        return recordedAt;
    }
}
