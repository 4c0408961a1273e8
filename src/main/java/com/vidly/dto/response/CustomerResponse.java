package com.vidly.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record CustomerResponse(
    Long id,
    String name,
    String phone,
    @JsonProperty("isGold") boolean isGold,
    Instant createdAt,
    Instant updatedAt
) {}
