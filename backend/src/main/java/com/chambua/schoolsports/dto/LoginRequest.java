package com.chambua.schoolsports.dto;

public record LoginRequest(String email, String contact) {}
