package com.vidly.mapper;

import com.vidly.dto.request.GenreRequest;
import com.vidly.dto.response.GenreResponse;
import com.vidly.entity.Genre;

public final class GenreMapper {

    private GenreMapper() {}

    public static Genre toEntity(GenreRequest request) {
        Genre genre = new Genre();
        updateEntity(genre, request);
        return genre;
    }

    public static GenreResponse toResponse(Genre genre) {
        return new GenreResponse(genre.getId(), genre.getName());
    }

    public static void updateEntity(Genre genre, GenreRequest request) {
        genre.setName(request.name().trim());
    }
}
