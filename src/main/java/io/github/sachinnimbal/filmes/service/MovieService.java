package io.github.sachinnimbal.filmes.service;

import io.github.sachinnimbal.filmes.core.response.PageResponse;
import io.github.sachinnimbal.filmes.dto.CreateMovieRequest;
import io.github.sachinnimbal.filmes.dto.MoviePatch;
import io.github.sachinnimbal.filmes.dto.MovieResponse;
import io.github.sachinnimbal.filmes.dto.UpdateMovieRequest;

public interface MovieService {

    MovieResponse create(CreateMovieRequest request);

    /**
     * @param page     1-based page number, defaults to 1 when null
     * @param pageSize defaults to the configured page size when null
     */
    PageResponse<MovieResponse> list(Integer page, Integer pageSize);

    MovieResponse getById(long id);

    void updateFull(long id, UpdateMovieRequest request);

    void updatePartial(long id, MoviePatch patch);

    void delete(long id);
}
