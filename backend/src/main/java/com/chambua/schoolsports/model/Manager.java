package com.chambua.schoolsports.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/**
 * A sports manager. {@code email} is the login identifier and {@code contact} the login secret;
 * {@code sport} is free text matched by name against {@link Sport}.
 */
@Entity
@Table(name = "managers", uniqueConstraints = {
        @UniqueConstraint(name = "uk_managers_email", columnNames = {"email"})
}, indexes = {
        @Index(name = "idx_managers_sport", columnList = "sport"),
        @Index(name = "idx_managers_team", columnList = "team_id")
})
public class Manager {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String department;

    @Column(nullable = false)
    private String sport;

    @Column(nullable = false)
    private String contact;

    @Column(nullable = false)
    private String email;

    @Column(name = "student_count", nullable = false)
    private int studentCount;

    @Column(name = "team_id")
    private Long teamId;

    // Read-only side of team_id; carries the ON DELETE SET NULL foreign key
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "team_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_manager_team"))
    @OnDelete(action = OnDeleteAction.SET_NULL)
    @JsonIgnore
    private Team team;

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

    public Manager() {}

    public Manager(String name, String department, String sport, String contact, String email, int studentCount) {
        this.name = name;
        this.department = department;
        this.sport = sport;
        this.contact = contact;
        this.email = email;
        this.studentCount = studentCount;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDepartment() { return department; }
    public void setDepartment(String department) { this.department = department; }

    public String getSport() { return sport; }
    public void setSport(String sport) { this.sport = sport; }

    public String getContact() { return contact; }
    public void setContact(String contact) { this.contact = contact; }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }

    public int getStudentCount() { return studentCount; }
    public void setStudentCount(int studentCount) { this.studentCount = studentCount; }

    public Long getTeamId() { return teamId; }
    public void setTeamId(Long teamId) { this.teamId = teamId; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
