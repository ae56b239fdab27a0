package org.example.progress.entity;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Entity
@Table(
        name = "reading_progress",
        uniqueConstraints = {
                @UniqueConstraint(columnNames = {"reader_id", "book_id", "context_key"})
        }
)
public class ReadingProgressEntity {

    public static final BigDecimal COMPLETE_PERCENT = new BigDecimal("100.00");

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "reader_id", nullable = false, length = 120)
    private String readerId;

    @Column(name = "book_id", nullable = false, length = 64)
    private String bookId;

    // Empty string when the read-through is not bound to an event
    @Column(name = "context_key", nullable = false, length = 120)
    private String contextKey = "";

    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal percent = BigDecimal.ZERO.setScale(2);

    @Column(name = "current_page")
    private Integer currentPage;

    @Column(name = "custom_total_pages")
    private Integer customTotalPages;

    @Column(name = "audio_playback_speed", precision = 3, scale = 1)
    private BigDecimal audioPlaybackSpeed;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_medium", length = 20)
    private MediumFormat lastMedium;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @OneToMany(mappedBy = "progress", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("activatedAt ASC")
    private List<ProgressMediumEntity> media = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public ReadingProgressEntity() {
    }

    public ReadingProgressEntity(String readerId, String bookId, String contextKey) {
        this.readerId = readerId;
        this.bookId = bookId;
        this.contextKey = contextKey == null ? "" : contextKey;
    }

    @PrePersist
    void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public Optional<ProgressMediumEntity> findMedium(MediumFormat medium) {
        return media.stream()
                .filter(state -> state.getMedium() == medium)
                .findFirst();
    }

    public boolean isActive(MediumFormat medium) {
        return findMedium(medium).isPresent();
    }

    public List<MediumFormat> getActiveFormats() {
        return media.stream()
                .map(ProgressMediumEntity::getMedium)
                .toList();
    }

    public void addMedium(ProgressMediumEntity state) {
        state.setProgress(this);
        media.add(state);
    }

    public void removeMedium(ProgressMediumEntity state) {
        media.remove(state);
    }

    public boolean isComplete() {
        return completedAt != null;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getReaderId() {
        return readerId;
    }

    public void setReaderId(String readerId) {
        this.readerId = readerId;
    }

    public String getBookId() {
        return bookId;
    }

    public void setBookId(String bookId) {
        this.bookId = bookId;
    }

    public String getContextKey() {
        return contextKey;
    }

    public void setContextKey(String contextKey) {
        this.contextKey = contextKey == null ? "" : contextKey;
    }

    public BigDecimal getPercent() {
        return percent;
    }

    public void setPercent(BigDecimal percent) {
        this.percent = percent;
    }

    public Integer getCurrentPage() {
        return currentPage;
    }

    public void setCurrentPage(Integer currentPage) {
        this.currentPage = currentPage;
    }

    public Integer getCustomTotalPages() {
        return customTotalPages;
    }

    public void setCustomTotalPages(Integer customTotalPages) {
        this.customTotalPages = customTotalPages;
    }

    public BigDecimal getAudioPlaybackSpeed() {
        return audioPlaybackSpeed;
    }

    public void setAudioPlaybackSpeed(BigDecimal audioPlaybackSpeed) {
        this.audioPlaybackSpeed = audioPlaybackSpeed;
    }

    public MediumFormat getLastMedium() {
        return lastMedium;
    }

    public void setLastMedium(MediumFormat lastMedium) {
        this.lastMedium = lastMedium;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(LocalDateTime completedAt) {
        this.completedAt = completedAt;
    }

    public List<ProgressMediumEntity> getMedia() {
        return media;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }
}
