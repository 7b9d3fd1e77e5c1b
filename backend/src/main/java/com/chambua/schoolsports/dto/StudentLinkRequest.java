package com.chambua.schoolsports.dto;

public record StudentLinkRequest(Long managerId) {}
