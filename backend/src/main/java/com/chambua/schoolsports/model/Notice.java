package com.chambua.schoolsports.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A published notice with an optional PDF document and an optional schedule image.
 */
@Entity
@Table(name = "notices", indexes = {
        @Index(name = "idx_notices_date", columnList = "notice_date")
})
public class Notice {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false, length = 4000)
    private String description;

    @Column(name = "document_url", length = 512)
    private String documentUrl;

    @Column(name = "schedule_image_url", length = 512)
    private String scheduleImageUrl;

    @Column(name = "notice_date", nullable = false)
    private LocalDate noticeDate;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    public void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = Instant.now();
    }

    public Notice() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getDocumentUrl() { return documentUrl; }
    public void setDocumentUrl(String documentUrl) { this.documentUrl = documentUrl; }

    public String getScheduleImageUrl() { return scheduleImageUrl; }
    public void setScheduleImageUrl(String scheduleImageUrl) { this.scheduleImageUrl = scheduleImageUrl; }

    public LocalDate getNoticeDate() { return noticeDate; }
    public void setNoticeDate(LocalDate noticeDate) { this.noticeDate = noticeDate; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
