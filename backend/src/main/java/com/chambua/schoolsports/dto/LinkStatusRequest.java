package com.chambua.schoolsports.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LinkStatusRequest(@JsonProperty("isActive") Boolean isActive) {}
