package org.example.progress.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(
        name = "progress_media",
        uniqueConstraints = {
                @UniqueConstraint(columnNames = {"progress_id", "medium"})
        }
)
public class ProgressMediumEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "progress_id", nullable = false)
    private ReadingProgressEntity progress;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MediumFormat medium;

    @Column(name = "current_page")
    private Integer currentPage;

    @Column(name = "total_pages_override")
    private Integer totalPagesOverride;

    @Column(name = "audio_position_seconds")
    private Long audioPositionSeconds;

    @Column(name = "audio_length_seconds")
    private Long audioLengthSeconds;

    @Column(name = "playback_speed", precision = 3, scale = 1)
    private BigDecimal playbackSpeed;

    @Column(name = "activated_at", nullable = false)
    private LocalDateTime activatedAt;

    public ProgressMediumEntity() {
    }

    public ProgressMediumEntity(MediumFormat medium) {
        this.medium = medium;
        this.activatedAt = LocalDateTime.now();
    }

    @PrePersist
    void onCreate() {
        if (activatedAt == null) {
            activatedAt = LocalDateTime.now();
        }
    }

    /**
     * Raw position in the medium's own unit: pages for paper and e-book,
     * seconds into the recording for audio.
     */
    public BigDecimal getRawPosition() {
        if (medium.isPageBased()) {
            return BigDecimal.valueOf(currentPage == null ? 0 : currentPage);
        }
        return BigDecimal.valueOf(audioPositionSeconds == null ? 0 : audioPositionSeconds);
    }

    public void setRawPosition(BigDecimal rawPosition) {
        if (medium.isPageBased()) {
            currentPage = rawPosition.intValueExact();
        } else {
            audioPositionSeconds = rawPosition.longValueExact();
        }
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public ReadingProgressEntity getProgress() {
        return progress;
    }

    public void setProgress(ReadingProgressEntity progress) {
        this.progress = progress;
    }

    public MediumFormat getMedium() {
        return medium;
    }

    public void setMedium(MediumFormat medium) {
        this.medium = medium;
    }

    public Integer getCurrentPage() {
        return currentPage;
    }

    public void setCurrentPage(Integer currentPage) {
        this.currentPage = currentPage;
    }

    public Integer getTotalPagesOverride() {
        return totalPagesOverride;
    }

    public void setTotalPagesOverride(Integer totalPagesOverride) {
        this.totalPagesOverride = totalPagesOverride;
    }

    public Long getAudioPositionSeconds() {
        return audioPositionSeconds;
    }

    public void setAudioPositionSeconds(Long audioPositionSeconds) {
        this.audioPositionSeconds = audioPositionSeconds;
    }

    public Long getAudioLengthSeconds() {
        return audioLengthSeconds;
    }

    public void setAudioLengthSeconds(Long audioLengthSeconds) {
        this.audioLengthSeconds = audioLengthSeconds;
    }

    public BigDecimal getPlaybackSpeed() {
        return playbackSpeed;
    }

    public void setPlaybackSpeed(BigDecimal playbackSpeed) {
        this.playbackSpeed = playbackSpeed;
    }

    public LocalDateTime getActivatedAt() {
        return activatedAt;
    }

    public void setActivatedAt(LocalDateTime activatedAt) {
        this.activatedAt = activatedAt;
    }
}
