package com.chambua.schoolsports.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class StudentRequest {
    private String name;
    @JsonProperty("prn_uid")
    private String prnUid;
    private String contact;
    private String email;
    private String address;
    private String birthDate;
    private Long managerId;

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getPrnUid() { return prnUid; }
    public void setPrnUid(String prnUid) { this.prnUid = prnUid; }
    public String getContact() { return contact; }
    public void setContact(String contact) { this.contact = contact; }
    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }
    public String getAddress() { return address; }
    public void setAddress(String address) { this.address = address; }
    public String getBirthDate() { return birthDate; }
    public void setBirthDate(String birthDate) { this.birthDate = birthDate; }
    public Long getManagerId() { return managerId; }
    public void setManagerId(Long managerId) { this.managerId = managerId; }
}
