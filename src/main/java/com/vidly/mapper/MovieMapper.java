package com.vidly.mapper;

import com.vidly.dto.request.MovieRequest;
import com.vidly.dto.response.MovieResponse;
import com.vidly.entity.Genre;
import com.vidly.entity.Movie;

public final class MovieMapper {

    private MovieMapper() {}

    public static Movie toEntity(MovieRequest request, Genre genre) {
        Movie movie = new Movie();
        updateEntity(movie, request, genre);
        return movie;
    }

    public static MovieResponse toResponse(Movie movie) {
        return new MovieResponse(
            movie.getId(),
            movie.getTitle(),
            GenreMapper.toResponse(movie.getGenre()),
            movie.getNumberInStock(),
            movie.getDailyRentalRate(),
            movie.getCreatedAt(),
            movie.getUpdatedAt()
        );
    }

    public static void updateEntity(Movie movie, MovieRequest request, Genre genre) {
        movie.setTitle(request.title().trim());
        movie.setGenre(genre);
        movie.setNumberInStock(request.numberInStock());
        movie.setDailyRentalRate(request.dailyRentalRate());
    }
}
