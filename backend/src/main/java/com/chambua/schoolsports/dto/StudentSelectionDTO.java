package com.chambua.schoolsports.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public class StudentSelectionDTO {
    private Long id;
    private Long studentId;
    private Long managerId;
    private boolean selected;
    private Instant createdAt;
    private Instant updatedAt;
    private String studentName;
    private String prnUid;
    private String contact;
    private String email;

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
    public String getStudentName() { return studentName; }
    public void setStudentName(String studentName) { this.studentName = studentName; }
    @JsonProperty("prn_uid")
    public String getPrnUid() { return prnUid; }
    public void setPrnUid(String prnUid) { this.prnUid = prnUid; }
    public String getContact() { return contact; }
    public void setContact(String contact) { this.contact = contact; }
    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }
}
