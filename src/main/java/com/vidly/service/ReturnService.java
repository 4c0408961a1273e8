package com.vidly.service;

import com.vidly.dto.request.ReturnRequest;
import com.vidly.dto.response.RentalResponse;
import com.vidly.entity.Rental;
import com.vidly.exception.ResourceNotFoundException;
import com.vidly.exception.ReturnAlreadyProcessedException;
import com.vidly.mapper.RentalMapper;
import com.vidly.repository.MovieRepository;
import com.vidly.repository.RentalRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Service
@RequiredArgsConstructor
public class ReturnService {

    private static final Logger log = LoggerFactory.getLogger(ReturnService.class);

    private final RentalRepository rentalRepository;
    private final MovieRepository movieRepository;

    /**
     * Closes the customer's latest rental of the movie: stamps the return date, charges
     * whole days elapsed at the snapshotted daily rate, and puts the copy back in stock.
     */
    @Transactional
    public RentalResponse processReturn(ReturnRequest request) {
        Rental rental = rentalRepository
            .findFirstByCustomer_IdAndMovie_IdOrderByDateOutDesc(request.customerId(), request.movieId())
            .orElseThrow(() -> new ResourceNotFoundException("Rental not found."));

        if (rental.isReturned()) {
            throw new ReturnAlreadyProcessedException(rental.getId());
        }

        Instant now = Instant.now();
        rental.setDateReturned(now);
        rental.setRentalFee(calculateFee(rental, now));
        Rental saved = rentalRepository.save(rental);

        // flushes the rental first, then clears the persistence context
        if (movieRepository.incrementStock(request.movieId(), now) == 0) {
            log.warn("Movie {} no longer exists; stock not restored for rental {}",
                     request.movieId(), saved.getId());
        }

        log.info("Rental {} returned, fee {}", saved.getId(), saved.getRentalFee());
        return RentalMapper.toResponse(saved);
    }

    static BigDecimal calculateFee(Rental rental, Instant returnedAt) {
        long days = Math.max(0, ChronoUnit.DAYS.between(rental.getDateOut(), returnedAt));
        return rental.getMovie().getDailyRentalRate().multiply(BigDecimal.valueOf(days));
    }
}
