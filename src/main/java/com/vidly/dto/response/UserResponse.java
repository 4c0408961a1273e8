package com.vidly.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UserResponse(
    Long id,
    String name,
    String email,
    @JsonProperty("isAdmin") boolean isAdmin
) {}
