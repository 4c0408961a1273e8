package com.vidly.exception;

/**
 * A request body names a related resource (customer, movie, genre) that does not exist.
 * Reported as 400 rather than 404: the addressed resource exists, the payload is wrong.
 */
public class InvalidReferenceException extends RuntimeException {

    private final String reference;

    public InvalidReferenceException(String reference) {
        super("Invalid " + reference + ".");
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
