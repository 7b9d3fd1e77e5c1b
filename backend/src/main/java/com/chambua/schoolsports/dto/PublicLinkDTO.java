package com.chambua.schoolsports.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** What an anonymous visitor of a registration link may see about the link and its manager. */
public record PublicLinkDTO(Long id, String token, @JsonProperty("isActive") boolean isActive, Long managerId,
                            String managerName, String department, String sport) {}
