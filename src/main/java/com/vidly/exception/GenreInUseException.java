package com.vidly.exception;

public class GenreInUseException extends RuntimeException {

    public GenreInUseException(Long genreId) {
        super("Genre " + genreId + " cannot be deleted while movies reference it");
    }
}
