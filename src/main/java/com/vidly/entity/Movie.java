package com.vidly.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * JPA entity representing a rentable movie title.
 *
 * <p><strong>Stock accounting</strong>: {@link #numberInStock} is the only field contended
 * between concurrent requests. It is never modified through this entity by the rental
 * flows. {@code MovieRepository.decrementStock} and {@code MovieRepository.incrementStock}
 * update it with a single conditional JPQL statement, so the availability check and the
 * write happen under the same row lock. The {@code chk_movies_stock_non_negative}
 * constraint (V3 migration) backs this at the database level.
 *
 * <p><strong>Optimistic locking</strong>: {@link #version} guards catalogue edits made
 * through {@code PUT /api/movies/{id}}. The bulk stock updates increment it explicitly,
 * so an edit based on a stale stock count fails with a 409 instead of overwriting it.
 *
 * <p>{@code genre} is {@code LAZY} with {@code optional = false}. The movie response
 * needs only the genre id and name, read inside the service transaction.
 */
@Entity
@Table(name = "movies")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Movie extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "genre_id", nullable = false)
    private Genre genre;

    @Column(name = "number_in_stock", nullable = false)
    private int numberInStock;

    @Column(name = "daily_rental_rate", nullable = false, precision = 6, scale = 2)
    private BigDecimal dailyRentalRate;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;
}
