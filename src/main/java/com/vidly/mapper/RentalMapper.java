package com.vidly.mapper;

import com.vidly.dto.request.RentalRequest;
import com.vidly.dto.response.RentalResponse;
import com.vidly.entity.Customer;
import com.vidly.entity.CustomerSnapshot;
import com.vidly.entity.Movie;
import com.vidly.entity.MovieSnapshot;
import com.vidly.entity.Rental;

public final class RentalMapper {

    private RentalMapper() {}

    public static Rental toEntity(RentalRequest request, Customer customer, Movie movie) {
        Rental rental = new Rental();
        updateEntity(rental, request, customer, movie);
        return rental;
    }

    /**
     * Rewrites the snapshots and dates wholesale. Create and update share this so both
     * record the movie title and the daily rate the same way.
     */
    public static void updateEntity(Rental rental, RentalRequest request, Customer customer, Movie movie) {
        rental.setCustomer(CustomerSnapshot.of(customer));
        rental.setMovie(MovieSnapshot.of(movie));
        rental.setDateOut(request.dateOut());
        rental.setDateReturned(request.dateReturned());
        rental.setRentalFee(request.rentalFee());
    }

    public static RentalResponse toResponse(Rental rental) {
        CustomerSnapshot customer = rental.getCustomer();
        MovieSnapshot movie = rental.getMovie();
        return new RentalResponse(
            rental.getId(),
            new RentalResponse.CustomerSummary(customer.getId(), customer.getName()),
            new RentalResponse.MovieSummary(movie.getId(), movie.getTitle(), movie.getDailyRentalRate()),
            rental.getDateOut(),
            rental.getDateReturned(),
            rental.getRentalFee()
        );
    }
}
