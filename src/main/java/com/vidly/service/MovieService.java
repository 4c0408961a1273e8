package com.vidly.service;

import com.vidly.dto.request.MovieRequest;
import com.vidly.dto.response.MovieResponse;
import com.vidly.entity.Genre;
import com.vidly.entity.Movie;
import com.vidly.exception.InvalidReferenceException;
import com.vidly.exception.ResourceNotFoundException;
import com.vidly.mapper.MovieMapper;
import com.vidly.repository.GenreRepository;
import com.vidly.repository.MovieRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class MovieService {

    private final MovieRepository movieRepository;
    private final GenreRepository genreRepository;

    @Transactional(readOnly = true)
    public List<MovieResponse> findAll() {
        return movieRepository.findAllWithGenre(Sort.by("title")).stream()
            .map(MovieMapper::toResponse)
            .toList();
    }

    @Transactional(readOnly = true)
    public MovieResponse findById(Long id) {
        return MovieMapper.toResponse(findMovie(id));
    }

    @Transactional
    public MovieResponse create(MovieRequest request) {
        Genre genre = resolveGenre(request.genreId());
        Movie saved = movieRepository.save(MovieMapper.toEntity(request, genre));
        return MovieMapper.toResponse(saved);
    }

    /**
     * Full replacement, including {@code numberInStock}. Concurrent rentals bump the
     * movie's version, so an edit made from a stale read fails with a 409.
     */
    @Transactional
    public MovieResponse update(Long id, MovieRequest request) {
        Movie movie = findMovie(id);
        Genre genre = resolveGenre(request.genreId());
        MovieMapper.updateEntity(movie, request, genre);
        return MovieMapper.toResponse(movieRepository.save(movie));
    }

    /** Existing rentals keep their snapshot of the movie. */
    @Transactional
    public MovieResponse delete(Long id) {
        Movie movie = findMovie(id);
        MovieResponse response = MovieMapper.toResponse(movie);
        movieRepository.delete(movie);
        return response;
    }

    private Movie findMovie(Long id) {
        return movieRepository.findByIdWithGenre(id)
            .orElseThrow(() -> new ResourceNotFoundException("Movie", id));
    }

    private Genre resolveGenre(Long genreId) {
        return genreRepository.findById(genreId)
            .orElseThrow(() -> new InvalidReferenceException("genre"));
    }
}
