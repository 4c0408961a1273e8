package com.vidly.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record GenreRequest(

    @NotBlank(message = "Name must not be blank")
    @Size(min = 5, max = 50, message = "Name must be between 5 and 50 characters")
    String name
) {}
