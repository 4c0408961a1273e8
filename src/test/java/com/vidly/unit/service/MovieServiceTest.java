package com.vidly.unit.service;

import com.vidly.dto.request.MovieRequest;
import com.vidly.dto.response.MovieResponse;
import com.vidly.entity.Genre;
import com.vidly.entity.Movie;
import com.vidly.exception.InvalidReferenceException;
import com.vidly.exception.ResourceNotFoundException;
import com.vidly.repository.GenreRepository;
import com.vidly.repository.MovieRepository;
import com.vidly.service.MovieService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MovieServiceTest {

    @Mock
    private MovieRepository movieRepository;

    @Mock
    private GenreRepository genreRepository;

    @InjectMocks
    private MovieService movieService;

    @Test
    void create_withExistingGenre_returnsMovieWithGenre() {
        Genre genre = createTestGenre(3L, "Action");
        when(genreRepository.findById(3L)).thenReturn(Optional.of(genre));
        when(movieRepository.save(any(Movie.class))).thenAnswer(invocation -> {
            Movie saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", 1L);
            return saved;
        });

        MovieResponse response = movieService.create(
            new MovieRequest("Terminator", 3L, 5, new BigDecimal("2.00")));

        assertThat(response.id()).isEqualTo(1L);
        assertThat(response.title()).isEqualTo("Terminator");
        assertThat(response.genre().name()).isEqualTo("Action");
        assertThat(response.numberInStock()).isEqualTo(5);
        assertThat(response.dailyRentalRate()).isEqualByComparingTo("2.00");
    }

    @Test
    void create_withUnknownGenre_throwsInvalidReference() {
        when(genreRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> movieService.create(
            new MovieRequest("Terminator", 99L, 5, new BigDecimal("2.00"))))
            .isInstanceOf(InvalidReferenceException.class)
            .hasMessage("Invalid genre.");

        verify(movieRepository, never()).save(any());
    }

    @Test
    void findById_whenNotFound_throwsResourceNotFoundException() {
        when(movieRepository.findByIdWithGenre(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> movieService.findById(99L))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessageContaining("Movie");
    }

    @Test
    void update_replacesAllFieldsIncludingStock() {
        Movie movie = createTestMovie(1L, "Terminator", createTestGenre(3L, "Action"));
        Genre comedy = createTestGenre(4L, "Comedy");
        when(movieRepository.findByIdWithGenre(1L)).thenReturn(Optional.of(movie));
        when(genreRepository.findById(4L)).thenReturn(Optional.of(comedy));
        when(movieRepository.save(movie)).thenReturn(movie);

        MovieResponse response = movieService.update(1L,
            new MovieRequest("Airplane!", 4L, 9, new BigDecimal("1.25")));

        assertThat(response.title()).isEqualTo("Airplane!");
        assertThat(response.genre().id()).isEqualTo(4L);
        assertThat(response.numberInStock()).isEqualTo(9);
        assertThat(response.dailyRentalRate()).isEqualByComparingTo("1.25");
    }

    @Test
    void delete_returnsDeletedMovie() {
        Movie movie = createTestMovie(1L, "Terminator", createTestGenre(3L, "Action"));
        when(movieRepository.findByIdWithGenre(1L)).thenReturn(Optional.of(movie));

        MovieResponse response = movieService.delete(1L);

        assertThat(response.title()).isEqualTo("Terminator");
        verify(movieRepository).delete(movie);
    }

    private Genre createTestGenre(Long id, String name) {
        Genre genre = new Genre();
        ReflectionTestUtils.setField(genre, "id", id);
        genre.setName(name);
        return genre;
    }

    private Movie createTestMovie(Long id, String title, Genre genre) {
        Movie movie = new Movie();
        ReflectionTestUtils.setField(movie, "id", id);
        movie.setTitle(title);
        movie.setGenre(genre);
        movie.setNumberInStock(3);
        movie.setDailyRentalRate(new BigDecimal("2.00"));
        return movie;
    }
}
