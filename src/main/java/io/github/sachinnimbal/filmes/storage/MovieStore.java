package io.github.sachinnimbal.filmes.storage;

import io.github.sachinnimbal.filmes.core.model.Movie;
import org.springframework.data.domain.Page;

import java.util.Optional;

/**
 * Persistence of movie records. Implementations hand out and take in detached copies, so callers can
 * never change stored state except through this contract. Every operation is atomic for a single record.
 */
public interface MovieStore {

    Optional<Movie> findById(long id);

    /**
     * Slice of the movies in insertion order starting at {@code (pageNumber - 1) * pageSize}.
     *
     * @param pageNumber 1-based page number
     * @param pageSize   maximum number of movies on the page, at least 1
     */
    Page<Movie> findPage(int pageNumber, int pageSize);

    /**
     * Stores a new movie under a freshly assigned id. Ids grow monotonically and are never reused,
     * even after a delete. Any id already set on the argument is ignored.
     *
     * @return copy of the stored movie carrying its id
     */
    Movie insert(Movie movie);

    /**
     * @return false when no movie with this id exists
     */
    boolean replace(long id, Movie movie);

    /**
     * @return false when no movie with this id exists
     */
    boolean delete(long id);

    long count();
}
