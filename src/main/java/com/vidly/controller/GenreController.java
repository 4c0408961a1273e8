package com.vidly.controller;

import com.vidly.dto.request.GenreRequest;
import com.vidly.dto.response.GenreResponse;
import com.vidly.service.GenreService;
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
@RequestMapping("/api/genres")
@RequiredArgsConstructor
@Tag(name = "Genres", description = "Genre management operations")
public class GenreController {

    private final GenreService genreService;

    @GetMapping
    @Operation(summary = "List all genres", description = "Sorted by name.")
    public ResponseEntity<List<GenreResponse>> findAll() {
        return ResponseEntity.ok(genreService.findAll());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get genre by ID")
    @ApiResponse(responseCode = "200", description = "Genre found")
    @ApiResponse(responseCode = "404", description = "Genre not found")
    public ResponseEntity<GenreResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(genreService.findById(id));
    }

    @PostMapping
    @SecurityRequirement(name = "x-auth-token")
    @Operation(summary = "Create a genre")
    @ApiResponse(responseCode = "200", description = "Genre created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "401", description = "Missing or invalid token")
    public ResponseEntity<GenreResponse> create(@Valid @RequestBody GenreRequest request) {
        return ResponseEntity.ok(genreService.create(request));
    }

    @PutMapping("/{id}")
    @SecurityRequirement(name = "x-auth-token")
    @Operation(summary = "Rename a genre")
    @ApiResponse(responseCode = "200", description = "Genre updated")
    @ApiResponse(responseCode = "404", description = "Genre not found")
    public ResponseEntity<GenreResponse> update(@PathVariable Long id,
                                                @Valid @RequestBody GenreRequest request) {
        return ResponseEntity.ok(genreService.update(id, request));
    }

    @DeleteMapping("/{id}")
    @SecurityRequirement(name = "x-auth-token")
    @Operation(summary = "Delete a genre", description = "Admin only. Returns 409 while movies reference the genre.")
    @ApiResponse(responseCode = "200", description = "Genre deleted")
    @ApiResponse(responseCode = "403", description = "Caller is not an admin")
    @ApiResponse(responseCode = "404", description = "Genre not found")
    @ApiResponse(responseCode = "409", description = "Genre is in use")
    public ResponseEntity<GenreResponse> delete(@PathVariable Long id) {
        return ResponseEntity.ok(genreService.delete(id));
    }
}
