package com.chambua.schoolsports.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SelectionRequest(Long studentId, Long managerId, @JsonProperty("isSelected") Boolean isSelected) {}
