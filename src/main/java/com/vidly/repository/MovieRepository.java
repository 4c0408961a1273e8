package com.vidly.repository;

import com.vidly.entity.Movie;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface MovieRepository extends JpaRepository<Movie, Long> {

    @Query("SELECT m FROM Movie m JOIN FETCH m.genre WHERE m.id = :id")
    Optional<Movie> findByIdWithGenre(@Param("id") Long id);

    @Query("SELECT m FROM Movie m JOIN FETCH m.genre")
    List<Movie> findAllWithGenre(Sort sort);

    boolean existsByGenreId(Long genreId);

    /**
     * Takes one copy out of stock if, and only if, at least one is left.
     *
     * <p>The predicate and the write are a single statement, so the row lock taken by the
     * UPDATE serialises concurrent callers: a second transaction blocked on the same row
     * re-evaluates {@code numberInStock > 0} after the first commits.
     *
     * @return 1 if a copy was taken, 0 if the movie is missing or out of stock
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Movie m SET m.numberInStock = m.numberInStock - 1, m.version = m.version + 1, "
        + "m.updatedAt = :now WHERE m.id = :id AND m.numberInStock > 0")
    int decrementStock(@Param("id") Long id, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Movie m SET m.numberInStock = m.numberInStock + 1, m.version = m.version + 1, "
        + "m.updatedAt = :now WHERE m.id = :id")
    int incrementStock(@Param("id") Long id, @Param("now") Instant now);
}
