package com.vidly.dto.request;

import jakarta.validation.constraints.NotNull;

public record ReturnRequest(

    @NotNull(message = "Customer ID is required")
    Long customerId,

    @NotNull(message = "Movie ID is required")
    Long movieId
) {}
