package com.vidly.service;

import com.vidly.config.VidlyProperties;
import com.vidly.dto.request.RentalRequest;
import com.vidly.dto.response.RentalResponse;
import com.vidly.entity.Customer;
import com.vidly.entity.Movie;
import com.vidly.entity.Rental;
import com.vidly.exception.InvalidReferenceException;
import com.vidly.exception.OutOfStockException;
import com.vidly.exception.RentalTransactionException;
import com.vidly.exception.ResourceNotFoundException;
import com.vidly.mapper.RentalMapper;
import com.vidly.repository.CustomerRepository;
import com.vidly.repository.MovieRepository;
import com.vidly.repository.RentalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;

/**
 * Rental lifecycle: creation with stock accounting, plus plain read, update and delete.
 *
 * <p><strong>Creation</strong> runs its preconditions (customer exists, movie exists, movie
 * has stock) without side effects, then executes the stock decrement and the rental insert
 * in one programmatic transaction. The decrement is conditional on stock remaining, so a
 * concurrent request that took the last copy between the precheck and the transaction is
 * caught here and reported as out of stock. Any store or commit failure inside the
 * transaction is rolled back as a whole and surfaced as {@link RentalTransactionException}.
 *
 * <p>A {@link TransactionTemplate} is used instead of {@code @Transactional} on
 * {@link #create} so that failures raised at commit time are translated too.
 */
@Service
public class RentalService {

    private static final Logger log = LoggerFactory.getLogger(RentalService.class);

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "dateOut");

    private final RentalRepository rentalRepository;
    private final CustomerRepository customerRepository;
    private final MovieRepository movieRepository;
    private final TransactionTemplate rentalTransaction;

    public RentalService(RentalRepository rentalRepository,
                         CustomerRepository customerRepository,
                         MovieRepository movieRepository,
                         PlatformTransactionManager transactionManager,
                         VidlyProperties properties) {
        this.rentalRepository = rentalRepository;
        this.customerRepository = customerRepository;
        this.movieRepository = movieRepository;
        this.rentalTransaction = new TransactionTemplate(transactionManager);
        this.rentalTransaction.setName("rental-create");
        this.rentalTransaction.setTimeout(
            (int) Math.max(1, properties.rentals().transactionTimeout().toSeconds()));
    }

    public RentalResponse create(RentalRequest request) {
        Customer customer = customerRepository.findById(request.customerId())
            .orElseThrow(() -> new InvalidReferenceException("customer"));
        Movie movie = movieRepository.findById(request.movieId())
            .orElseThrow(() -> new InvalidReferenceException("movie"));

        if (movie.getNumberInStock() == 0) {
            throw new OutOfStockException(movie.getId());
        }

        Rental rental = RentalMapper.toEntity(request, customer, movie);
        Rental saved;
        try {
            saved = rentalTransaction.execute(status -> {
                if (movieRepository.decrementStock(movie.getId(), Instant.now()) == 0) {
                    log.warn("Movie {} ran out of stock before customer {} could rent it",
                             movie.getId(), customer.getId());
                    throw new OutOfStockException(movie.getId());
                }
                return rentalRepository.save(rental);
            });
        } catch (DataAccessException | TransactionException ex) {
            throw new RentalTransactionException(movie.getId(), ex);
        }

        log.info("Rental {} created: customer {} rented movie {}",
                 saved.getId(), customer.getId(), movie.getId());
        return RentalMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<RentalResponse> findAll() {
        return rentalRepository.findAll(NEWEST_FIRST).stream()
            .map(RentalMapper::toResponse)
            .toList();
    }

    @Transactional(readOnly = true)
    public RentalResponse findById(Long id) {
        Rental rental = rentalRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Rental", id));
        return RentalMapper.toResponse(rental);
    }

    /**
     * Replaces the snapshots and dates of an existing rental. References are re-resolved
     * first, so a dangling customer or movie is a 400 even when the rental itself is missing.
     * Stock is not adjusted, even when the movie changes.
     */
    @Transactional
    public RentalResponse update(Long id, RentalRequest request) {
        Customer customer = customerRepository.findById(request.customerId())
            .orElseThrow(() -> new InvalidReferenceException("customer"));
        Movie movie = movieRepository.findById(request.movieId())
            .orElseThrow(() -> new InvalidReferenceException("movie"));

        Rental rental = rentalRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Rental", id));

        RentalMapper.updateEntity(rental, request, customer, movie);
        return RentalMapper.toResponse(rentalRepository.save(rental));
    }

    /** Removes the rental record. The movie's stock is left as it is. */
    @Transactional
    public RentalResponse delete(Long id) {
        Rental rental = rentalRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Rental", id));
        rentalRepository.delete(rental);
        return RentalMapper.toResponse(rental);
    }
}
