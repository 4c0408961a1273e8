package com.vidly.exception;

/**
 * The paired rental insert and stock decrement could not be committed. Both changes were
 * rolled back. The cause carries store diagnostics and is logged, never returned to callers.
 */
public class RentalTransactionException extends RuntimeException {

    public RentalTransactionException(Long movieId, Throwable cause) {
        super("Rental transaction failed for movie " + movieId, cause);
    }
}
