package com.chambua.schoolsports.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Create/update body for a manager. {@code studentCount} is kept as text so that both JSON numbers
 * and numeric strings from form clients reach the validator unchanged. {@link #isTeamIdSet()} tells an
 * omitted {@code teamId} apart from an explicit {@code null}.
 */
public class ManagerRequest {
    private String name;
    private String department;
    private String sport;
    private String contact;
    private String email;
    private String studentCount;
    private Long teamId;
    private boolean teamIdSet;

    public ManagerRequest() {}

    public ManagerRequest(String name, String department, String sport, String contact, String email,
                          String studentCount, Long teamId) {
        this.name = name;
        this.department = department;
        this.sport = sport;
        this.contact = contact;
        this.email = email;
        this.studentCount = studentCount;
        this.teamId = teamId;
        this.teamIdSet = true;
    }

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
    public String getStudentCount() { return studentCount; }
    public void setStudentCount(String studentCount) { this.studentCount = studentCount; }
    public Long getTeamId() { return teamId; }
    public void setTeamId(Long teamId) {
        this.teamId = teamId;
        this.teamIdSet = true;
    }

    @JsonIgnore
    public boolean isTeamIdSet() { return teamIdSet; }
}
