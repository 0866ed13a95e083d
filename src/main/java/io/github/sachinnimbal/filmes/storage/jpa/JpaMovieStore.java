package io.github.sachinnimbal.filmes.storage.jpa;

import io.github.sachinnimbal.filmes.core.exception.StorageException;
import io.github.sachinnimbal.filmes.core.model.Movie;
import io.github.sachinnimbal.filmes.storage.MovieStore;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Root;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Relational store on top of JPA. Ids come from the database identity column, which never hands out
 * a value twice; pages are ordered by id, which matches insertion order.
 */
@Slf4j
@Transactional
public class JpaMovieStore implements MovieStore {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional(readOnly = true)
    public Optional<Movie> findById(long id) {
        return execute("find movie " + id, () ->
                Optional.ofNullable(entityManager.find(Movie.class, id)).map(Movie::copy));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<Movie> findPage(int pageNumber, int pageSize) {
        PageRequest pageable = PageRequest.of(pageNumber - 1, pageSize);

        return execute("read movie page " + pageNumber, () -> {
            long total = countMovies();
            if (pageable.getOffset() >= total) {
                return new PageImpl<>(Collections.emptyList(), pageable, total);
            }

            CriteriaBuilder cb = entityManager.getCriteriaBuilder();
            CriteriaQuery<Movie> query = cb.createQuery(Movie.class);
            Root<Movie> root = query.from(Movie.class);
            query.select(root).orderBy(cb.asc(root.get("id")));

            List<Movie> content = entityManager.createQuery(query)
                    .setFirstResult((int) pageable.getOffset())
                    .setMaxResults(pageSize)
                    .getResultList()
                    .stream()
                    .map(Movie::copy)
                    .toList();

            return new PageImpl<>(content, pageable, total);
        });
    }

    @Override
    public Movie insert(Movie movie) {
        return execute("insert movie", () -> {
            Movie managed = movie.copy();
            managed.setId(null);
            entityManager.persist(managed);
            entityManager.flush();

            log.debug("Persisted movie {}", managed.getId());
            return managed.copy();
        });
    }

    @Override
    public boolean replace(long id, Movie movie) {
        return execute("replace movie " + id, () -> {
            Movie managed = entityManager.find(Movie.class, id);
            if (managed == null) {
                return false;
            }
            managed.setTitle(movie.getTitle());
            managed.setGenre(movie.getGenre());
            managed.setDurationMinutes(movie.getDurationMinutes());
            managed.setDirector(movie.getDirector());
            managed.setDescription(movie.getDescription());
            managed.setUpdatedAt(movie.getUpdatedAt());
            entityManager.flush();
            return true;
        });
    }

    @Override
    public boolean delete(long id) {
        return execute("delete movie " + id, () -> {
            Movie managed = entityManager.find(Movie.class, id);
            if (managed == null) {
                return false;
            }
            entityManager.remove(managed);
            entityManager.flush();
            return true;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public long count() {
        return execute("count movies", this::countMovies);
    }

    private long countMovies() {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Long> query = cb.createQuery(Long.class);
        query.select(cb.count(query.from(Movie.class)));
        return entityManager.createQuery(query).getSingleResult();
    }

    private <R> R execute(String action, Supplier<R> work) {
        try {
            return work.get();
        } catch (PersistenceException e) {
            log.error("Storage failure during {}: {}", action, e.getMessage(), e);
            throw new StorageException("Failed to " + action, e);
        }
    }
}
