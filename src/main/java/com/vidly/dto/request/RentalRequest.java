package com.vidly.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Body of {@code POST /api/rentals} and {@code PUT /api/rentals/{id}}.
 * {@code dateReturned} and {@code rentalFee} are optional and normally left empty
 * until the return is processed.
 */
public record RentalRequest(

    @NotNull(message = "Customer ID is required")
    Long customerId,

    @NotNull(message = "Movie ID is required")
    Long movieId,

    @NotNull(message = "Date out is required")
    Instant dateOut,

    Instant dateReturned,

    @DecimalMin(value = "0", message = "Rental fee must not be negative")
    @Digits(integer = 8, fraction = 2, message = "Rental fee must have at most 8 digits and 2 decimals")
    BigDecimal rentalFee
) {}
