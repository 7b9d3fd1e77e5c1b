package com.chambua.schoolsports.dto;

/**
 * Public registration form posted against a link token. The manager comes from the link, so any
 * {@code managerId} in the body is ignored.
 */
public class StudentLinkSubmission extends StudentRequest {
    private String token;

    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }
}
