package com.vidly.controller;

import com.vidly.dto.request.RentalRequest;
import com.vidly.dto.response.RentalResponse;
import com.vidly.service.RentalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/rentals")
@RequiredArgsConstructor
@Tag(name = "Rentals", description = "Rental management with atomic stock accounting")
public class RentalController {

    private final RentalService rentalService;

    @GetMapping
    @Operation(summary = "List all rentals", description = "Most recent first (by dateOut).")
    public ResponseEntity<List<RentalResponse>> findAll() {
        return ResponseEntity.ok(rentalService.findAll());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get rental by ID")
    @ApiResponse(responseCode = "200", description = "Rental found")
    @ApiResponse(responseCode = "404", description = "Rental not found")
    public ResponseEntity<RentalResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(rentalService.findById(id));
    }

    @PostMapping
    @Operation(summary = "Rent a movie", description = "Creates the rental and takes one copy out of stock, "
        + "both or neither. Customer and movie details are copied into the rental.")
    @ApiResponse(responseCode = "200", description = "Rental created")
    @ApiResponse(responseCode = "400", description = "Validation error, unknown customer or movie, or movie not in stock")
    @ApiResponse(responseCode = "500", description = "Rental could not be committed; nothing was changed")
    public ResponseEntity<RentalResponse> create(@Valid @RequestBody RentalRequest request) {
        return ResponseEntity.ok(rentalService.create(request));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a rental", description = "Full replacement of snapshots and dates. Stock is not adjusted.")
    @ApiResponse(responseCode = "200", description = "Rental updated")
    @ApiResponse(responseCode = "400", description = "Validation error or unknown customer or movie")
    @ApiResponse(responseCode = "404", description = "Rental not found")
    public ResponseEntity<RentalResponse> update(@PathVariable Long id,
                                                 @Valid @RequestBody RentalRequest request) {
        return ResponseEntity.ok(rentalService.update(id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a rental", description = "Returns the deleted rental. Stock is not restored.")
    @ApiResponse(responseCode = "200", description = "Rental deleted")
    @ApiResponse(responseCode = "404", description = "Rental not found")
    public ResponseEntity<RentalResponse> delete(@PathVariable Long id) {
        return ResponseEntity.ok(rentalService.delete(id));
    }
}
