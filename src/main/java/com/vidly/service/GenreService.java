package com.vidly.service;

import com.vidly.dto.request.GenreRequest;
import com.vidly.dto.response.GenreResponse;
import com.vidly.entity.Genre;
import com.vidly.exception.GenreInUseException;
import com.vidly.exception.ResourceNotFoundException;
import com.vidly.mapper.GenreMapper;
import com.vidly.repository.GenreRepository;
import com.vidly.repository.MovieRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class GenreService {

    private final GenreRepository genreRepository;
    private final MovieRepository movieRepository;

    @Transactional(readOnly = true)
    public List<GenreResponse> findAll() {
        return genreRepository.findAll(Sort.by("name")).stream()
            .map(GenreMapper::toResponse)
            .toList();
    }

    @Transactional(readOnly = true)
    public GenreResponse findById(Long id) {
        return GenreMapper.toResponse(findGenre(id));
    }

    @Transactional
    public GenreResponse create(GenreRequest request) {
        Genre saved = genreRepository.save(GenreMapper.toEntity(request));
        return GenreMapper.toResponse(saved);
    }

    @Transactional
    public GenreResponse update(Long id, GenreRequest request) {
        Genre genre = findGenre(id);
        GenreMapper.updateEntity(genre, request);
        return GenreMapper.toResponse(genreRepository.save(genre));
    }

    @Transactional
    public GenreResponse delete(Long id) {
        Genre genre = findGenre(id);

        if (movieRepository.existsByGenreId(id)) {
            throw new GenreInUseException(id);
        }

        genreRepository.delete(genre);
        return GenreMapper.toResponse(genre);
    }

    private Genre findGenre(Long id) {
        return genreRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Genre", id));
    }
}
