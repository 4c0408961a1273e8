package com.vidly.dto.response;

public record GenreResponse(
    Long id,
    String name
) {}
