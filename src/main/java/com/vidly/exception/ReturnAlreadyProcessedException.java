package com.vidly.exception;

public class ReturnAlreadyProcessedException extends RuntimeException {

    private final Long rentalId;

    public ReturnAlreadyProcessedException(Long rentalId) {
        super("Return already processed.");
        this.rentalId = rentalId;
    }

    public Long getRentalId() {
        return rentalId;
    }
}
