package com.vidly.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    int status,
    String error,
    String message,
    Instant timestamp,
    String path,
    List<FieldError> fieldErrors
) {
    public static ErrorResponse of(HttpStatus status, String message, String path) {
        return of(status, message, path, List.of());
    }

    public static ErrorResponse of(HttpStatus status, String message, String path,
                                   List<FieldError> fieldErrors) {
        return new ErrorResponse(status.value(), status.getReasonPhrase(), message,
                                 Instant.now(), path, fieldErrors);
    }

    public record FieldError(String field, String message) {}
}
