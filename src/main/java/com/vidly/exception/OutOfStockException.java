package com.vidly.exception;

public class OutOfStockException extends RuntimeException {

    private final Long movieId;

    public OutOfStockException(Long movieId) {
        super("Movie not in stock.");
        this.movieId = movieId;
    }

    public Long getMovieId() {
        return movieId;
    }
}
