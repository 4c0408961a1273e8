package com.vidly.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Movie data copied into a {@link Rental} when it is created. The daily rate is frozen
 * here so that later price changes do not alter the fee of an open rental.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MovieSnapshot {

    @Column(name = "movie_id", nullable = false)
    private Long id;

    @Column(name = "movie_title", nullable = false, length = 255)
    private String title;

    @Column(name = "daily_rental_rate", nullable = false, precision = 6, scale = 2)
    private BigDecimal dailyRentalRate;

    public static MovieSnapshot of(Movie movie) {
        return new MovieSnapshot(movie.getId(), movie.getTitle(), movie.getDailyRentalRate());
    }
}
