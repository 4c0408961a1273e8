package com.vidly.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity representing one movie rented by one customer.
 *
 * <p><strong>Denormalised snapshots</strong>: {@link #customer} and {@link #movie} are
 * embedded copies taken when the rental is created, kept for billing accuracy. The
 * {@code rentals} table has no foreign keys to {@code customers} or {@code movies}.
 *
 * <p><strong>Creation</strong>: rentals are only inserted by {@code RentalService.create()},
 * in the same transaction that decrements the movie's stock.
 *
 * <p><strong>Lifecycle</strong>: {@link #dateReturned} and {@link #rentalFee} stay
 * {@code null} while the rental is open and are set by {@code ReturnService} when the movie
 * comes back. {@link #version} guards against two returns of the same rental racing.
 */
@Entity
@Table(name = "rentals")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Rental extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Embedded
    private CustomerSnapshot customer;

    @Embedded
    private MovieSnapshot movie;

    @Column(name = "date_out", nullable = false)
    private Instant dateOut;

    @Column(name = "date_returned")
    private Instant dateReturned;

    @Column(name = "rental_fee", precision = 10, scale = 2)
    private BigDecimal rentalFee;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    public boolean isReturned() {
        return dateReturned != null;
    }
}
