package com.vidly.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UserRequest(

    @NotBlank(message = "Name must not be blank")
    @Size(min = 5, max = 50, message = "Name must be between 5 and 50 characters")
    String name,

    @NotBlank(message = "Email must not be blank")
    @Size(min = 5, max = 255, message = "Email must be between 5 and 255 characters")
    @Email(message = "Email must be a valid address")
    String email,

    @JsonProperty("isAdmin")
    Boolean isAdmin
) {}
