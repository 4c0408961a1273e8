package com.vidly.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record MovieRequest(

    @NotBlank(message = "Title must not be blank")
    @Size(min = 5, max = 255, message = "Title must be between 5 and 255 characters")
    String title,

    @NotNull(message = "Genre ID is required")
    Long genreId,

    @NotNull(message = "Number in stock is required")
    @Min(value = 0, message = "Number in stock must not be negative")
    @Max(value = 255, message = "Number in stock must not exceed 255")
    Integer numberInStock,

    @NotNull(message = "Daily rental rate is required")
    @DecimalMin(value = "0", message = "Daily rental rate must not be negative")
    @DecimalMax(value = "255", message = "Daily rental rate must not exceed 255")
    BigDecimal dailyRentalRate
) {}
