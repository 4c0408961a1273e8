package com.vidly.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CustomerRequest(

    @NotBlank(message = "Name must not be blank")
    @Size(min = 5, max = 50, message = "Name must be between 5 and 50 characters")
    String name,

    @NotBlank(message = "Phone must not be blank")
    @Size(min = 5, max = 50, message = "Phone must be between 5 and 50 characters")
    String phone,

    @JsonProperty("isGold")
    Boolean isGold
) {}
