package com.vidly.repository;

import com.vidly.entity.Rental;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.QueryHints;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import java.util.Optional;

public interface RentalRepository extends JpaRepository<Rental, Long> {

    /**
     * Latest rental of the given movie by the given customer, locked for the rest of the
     * transaction so two concurrent returns of the same rental cannot both succeed.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    Optional<Rental> findFirstByCustomer_IdAndMovie_IdOrderByDateOutDesc(Long customerId, Long movieId);
}
