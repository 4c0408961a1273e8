package com.vidly.dto.response;

import java.math.BigDecimal;
import java.time.Instant;

public record RentalResponse(
    Long id,
    CustomerSummary customer,
    MovieSummary movie,
    Instant dateOut,
    Instant dateReturned,
    BigDecimal rentalFee
) {
    public record CustomerSummary(Long id, String name) {}

    public record MovieSummary(Long id, String title, BigDecimal dailyRentalRate) {}
}
