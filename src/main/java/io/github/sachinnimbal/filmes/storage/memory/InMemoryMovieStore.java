package io.github.sachinnimbal.filmes.storage.memory;

import io.github.sachinnimbal.filmes.core.model.Movie;
import io.github.sachinnimbal.filmes.storage.MovieStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local store. Ids come from a sequence that only moves forward, and the map is ordered by id,
 * so iteration order is insertion order.
 */
@Slf4j
public class InMemoryMovieStore implements MovieStore {

    private final ConcurrentNavigableMap<Long, Movie> movies = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Optional<Movie> findById(long id) {
        return Optional.ofNullable(movies.get(id)).map(Movie::copy);
    }

    @Override
    public Page<Movie> findPage(int pageNumber, int pageSize) {
        PageRequest pageable = PageRequest.of(pageNumber - 1, pageSize);
        long total = movies.size();

        List<Movie> content = movies.values().stream()
                .skip(pageable.getOffset())
                .limit(pageSize)
                .map(Movie::copy)
                .toList();

        return new PageImpl<>(content, pageable, total);
    }

    @Override
    public Movie insert(Movie movie) {
        Movie stored = movie.copy();
        stored.setId(sequence.incrementAndGet());
        movies.put(stored.getId(), stored);

        log.debug("Stored movie {} ({} in store)", stored.getId(), movies.size());
        return stored.copy();
    }

    @Override
    public boolean replace(long id, Movie movie) {
        Movie stored = movie.copy();
        stored.setId(id);
        return movies.replace(id, stored) != null;
    }

    @Override
    public boolean delete(long id) {
        return movies.remove(id) != null;
    }

    @Override
    public long count() {
        return movies.size();
    }
}
