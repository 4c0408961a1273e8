package com.vidly.controller;

import com.vidly.dto.request.MovieRequest;
import com.vidly.dto.response.MovieResponse;
import com.vidly.service.MovieService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
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
@RequestMapping("/api/movies")
@RequiredArgsConstructor
@Tag(name = "Movies", description = "Movie catalogue and stock")
public class MovieController {

    private final MovieService movieService;

    @GetMapping
    @Operation(summary = "List all movies", description = "Sorted by title, with genre and current stock.")
    public ResponseEntity<List<MovieResponse>> findAll() {
        return ResponseEntity.ok(movieService.findAll());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get movie by ID")
    @ApiResponse(responseCode = "200", description = "Movie found")
    @ApiResponse(responseCode = "404", description = "Movie not found")
    public ResponseEntity<MovieResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(movieService.findById(id));
    }

    @PostMapping
    @SecurityRequirement(name = "x-auth-token")
    @Operation(summary = "Add a movie")
    @ApiResponse(responseCode = "200", description = "Movie created")
    @ApiResponse(responseCode = "400", description = "Validation error or unknown genre")
    @ApiResponse(responseCode = "401", description = "Missing or invalid token")
    public ResponseEntity<MovieResponse> create(@Valid @RequestBody MovieRequest request) {
        return ResponseEntity.ok(movieService.create(request));
    }

    @PutMapping("/{id}")
    @SecurityRequirement(name = "x-auth-token")
    @Operation(summary = "Update a movie", description = "Full replacement, including stock count.")
    @ApiResponse(responseCode = "200", description = "Movie updated")
    @ApiResponse(responseCode = "404", description = "Movie not found")
    @ApiResponse(responseCode = "409", description = "Movie changed concurrently")
    public ResponseEntity<MovieResponse> update(@PathVariable Long id,
                                                @Valid @RequestBody MovieRequest request) {
        return ResponseEntity.ok(movieService.update(id, request));
    }

    @DeleteMapping("/{id}")
    @SecurityRequirement(name = "x-auth-token")
    @Operation(summary = "Delete a movie", description = "Admin only.")
    @ApiResponse(responseCode = "200", description = "Movie deleted")
    @ApiResponse(responseCode = "403", description = "Caller is not an admin")
    @ApiResponse(responseCode = "404", description = "Movie not found")
    public ResponseEntity<MovieResponse> delete(@PathVariable Long id) {
        return ResponseEntity.ok(movieService.delete(id));
    }
}
