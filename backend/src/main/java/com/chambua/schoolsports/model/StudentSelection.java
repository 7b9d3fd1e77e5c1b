package com.chambua.schoolsports.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/**
 * Whether a manager has picked a student for the team. At most one row per (student, manager).
 */
@Entity
@Table(name = "student_selections", uniqueConstraints = {
        @UniqueConstraint(name = "uk_selection_student_manager", columnNames = {"student_id", "manager_id"})
}, indexes = {
        @Index(name = "idx_selections_student", columnList = "student_id"),
        @Index(name = "idx_selections_manager", columnList = "manager_id")
})
public class StudentSelection {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @Column(name = "manager_id", nullable = false)
    private Long managerId;

    @JsonProperty("isSelected")
    @Column(name = "is_selected", nullable = false)
    private boolean selected;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "student_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_selection_student"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    @JsonIgnore
    private Student student;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "manager_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_selection_manager"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    @JsonIgnore
    private Manager manager;

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

    public StudentSelection() {}

    public StudentSelection(Long studentId, Long managerId, boolean selected) {
        this.studentId = studentId;
        this.managerId = managerId;
        this.selected = selected;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Long getStudentId() { return studentId; }
    public void setStudentId(Long studentId) { this.studentId = studentId; }

    public Long getManagerId() { return managerId; }
    public void setManagerId(Long managerId) { this.managerId = managerId; }

    @JsonProperty("isSelected")
    public boolean isSelected() { return selected; }
    public void setSelected(boolean selected) { this.selected = selected; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
