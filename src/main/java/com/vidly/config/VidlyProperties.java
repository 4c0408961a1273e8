package com.vidly.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Application-specific settings bound from the {@code vidly.*} namespace.
 *
 * <p>{@code security.jwtSecret} is the shared HMAC key used to verify
 * {@code x-auth-token} values. HS256 requires at least 256 bits, hence the
 * 32 character minimum.
 */
@Validated
@ConfigurationProperties(prefix = "vidly")
public record VidlyProperties(
    @Valid @NotNull Security security,
    @Valid @DefaultValue Rentals rentals
) {

    public record Security(
        @NotBlank
        @Size(min = 32, message = "JWT secret must be at least 32 characters")
        String jwtSecret
    ) {}

    public record Rentals(
        @DefaultValue("5s") Duration transactionTimeout
    ) {}
}
