package com.chambua.schoolsports.dto;

public record CoachRequest(String name, String contact, String email, String specialization, Long managerId) {}
