package com.vidly.controller;

import com.vidly.dto.request.ReturnRequest;
import com.vidly.dto.response.RentalResponse;
import com.vidly.service.ReturnService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/returns")
@RequiredArgsConstructor
@Tag(name = "Returns", description = "Movie returns")
public class ReturnController {

    private final ReturnService returnService;

    @PostMapping
    @SecurityRequirement(name = "x-auth-token")
    @Operation(summary = "Return a rented movie", description = "Closes the customer's latest rental of the movie, "
        + "computes the fee and restores stock.")
    @ApiResponse(responseCode = "200", description = "Return processed")
    @ApiResponse(responseCode = "400", description = "Validation error or return already processed")
    @ApiResponse(responseCode = "401", description = "Missing or invalid token")
    @ApiResponse(responseCode = "404", description = "No rental for this customer and movie")
    public ResponseEntity<RentalResponse> processReturn(@Valid @RequestBody ReturnRequest request) {
        return ResponseEntity.ok(returnService.processReturn(request));
    }
}
