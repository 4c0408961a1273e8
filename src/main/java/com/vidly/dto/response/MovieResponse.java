package com.vidly.dto.response;

import java.math.BigDecimal;
import java.time.Instant;

public record MovieResponse(
    Long id,
    String title,
    GenreResponse genre,
    int numberInStock,
    BigDecimal dailyRentalRate,
    Instant createdAt,
    Instant updatedAt
) {}
