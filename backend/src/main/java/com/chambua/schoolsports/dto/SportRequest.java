package com.chambua.schoolsports.dto;

public record SportRequest(String name, String description) {}
