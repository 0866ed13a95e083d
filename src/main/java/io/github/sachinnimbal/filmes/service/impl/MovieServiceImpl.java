package io.github.sachinnimbal.filmes.service.impl;

import com.google.common.util.concurrent.Striped;
import io.github.sachinnimbal.filmes.core.config.FilmesProperties;
import io.github.sachinnimbal.filmes.core.exception.EntityNotFoundException;
import io.github.sachinnimbal.filmes.core.exception.ValidationException;
import io.github.sachinnimbal.filmes.core.model.Movie;
import io.github.sachinnimbal.filmes.core.response.PageResponse;
import io.github.sachinnimbal.filmes.dto.CreateMovieRequest;
import io.github.sachinnimbal.filmes.dto.MoviePatch;
import io.github.sachinnimbal.filmes.dto.MovieResponse;
import io.github.sachinnimbal.filmes.dto.UpdateMovieRequest;
import io.github.sachinnimbal.filmes.dto.mapper.MovieMapper;
import io.github.sachinnimbal.filmes.service.MovieService;
import io.github.sachinnimbal.filmes.service.impl.helper.FilmesValidationHelper;
import io.github.sachinnimbal.filmes.storage.MovieStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

import static io.github.sachinnimbal.filmes.core.util.TimeUtils.formatExecutionTime;

/**
 * Validates, maps and stores movies. Requests are validated before the store is touched, so a rejected
 * request never leaves a partial change behind. Read-modify-write sequences and deletes on the same id
 * are serialised; different ids proceed in parallel.
 */
@Slf4j
@Service
public class MovieServiceImpl implements MovieService {

    private static final String ENTITY_NAME = "Movie";
    private static final int LOCK_STRIPES = 64;

    private final MovieStore movieStore;
    private final MovieMapper movieMapper;
    private final FilmesValidationHelper validationHelper;
    private final FilmesProperties.Pagination pagination;
    private final Clock clock;

    private final Striped<Lock> idLocks = Striped.lazyWeakLock(LOCK_STRIPES);

    public MovieServiceImpl(MovieStore movieStore,
                            MovieMapper movieMapper,
                            FilmesValidationHelper validationHelper,
                            FilmesProperties properties,
                            Clock clock) {
        this.movieStore = movieStore;
        this.movieMapper = movieMapper;
        this.validationHelper = validationHelper;
        this.pagination = properties.getPagination();
        this.clock = clock;

        log.info("Movie service initialized with {} | default page size: {}",
                movieStore.getClass().getSimpleName(), pagination.getDefaultPageSize());
    }

    // ==================== CREATE ====================

    @Override
    public MovieResponse create(CreateMovieRequest request) {
        long start = System.currentTimeMillis();
        validationHelper.validateJakartaConstraints(request);

        Movie movie = movieMapper.fromCreateRequest(request);
        movie.onCreate(now());
        Movie created = movieStore.insert(movie);

        log.info("Movie created with ID: {} | Time: {}", created.getId(),
                formatExecutionTime(System.currentTimeMillis() - start));
        return movieMapper.toResponse(created);
    }

    // ==================== READ ====================

    @Override
    public PageResponse<MovieResponse> list(Integer page, Integer pageSize) {
        int pageNumber = resolvePage(page);
        int size = resolvePageSize(pageSize);

        Page<Movie> moviePage = movieStore.findPage(pageNumber, size);
        log.debug("Retrieved page {} with {} movies (total: {})",
                pageNumber, moviePage.getNumberOfElements(), moviePage.getTotalElements());

        return PageResponse.from(moviePage, movieMapper::toResponse);
    }

    @Override
    public MovieResponse getById(long id) {
        return movieMapper.toResponse(findExisting(id));
    }

    // ==================== UPDATE ====================

    @Override
    public void updateFull(long id, UpdateMovieRequest request) {
        long start = System.currentTimeMillis();
        validationHelper.validateJakartaConstraints(request);

        withIdLock(id, () -> {
            Movie existing = findExisting(id);
            Movie replacement = movieMapper.applyFullUpdate(existing, request);
            replacement.onUpdate(now());
            replaceExisting(id, replacement);
            return replacement;
        });

        log.info("Movie {} replaced | Time: {}", id, formatExecutionTime(System.currentTimeMillis() - start));
    }

    @Override
    public void updatePartial(long id, MoviePatch patch) {
        long start = System.currentTimeMillis();
        if (patch == null || patch.isEmpty()) {
            throw new ValidationException("Update data cannot be null or empty");
        }

        withIdLock(id, () -> {
            Movie existing = findExisting(id);
            Movie patched = movieMapper.applyPatch(existing, patch);
            patched.onUpdate(now());
            replaceExisting(id, patched);
            return patched;
        });

        log.info("Movie {} patched {} | Time: {}", id, patch.presentFields(),
                formatExecutionTime(System.currentTimeMillis() - start));
    }

    // ==================== DELETE ====================

    @Override
    public void delete(long id) {
        boolean deleted = withIdLock(id, () -> movieStore.delete(id));
        if (!deleted) {
            log.debug("Delete of unknown movie {}", id);
            throw new EntityNotFoundException(ENTITY_NAME, id);
        }
        log.info("Movie {} deleted", id);
    }

    // ==================== HELPERS ====================

    int resolvePage(Integer page) {
        return page == null ? 1 : Math.max(1, page);
    }

    int resolvePageSize(Integer pageSize) {
        int max = Math.max(1, pagination.getMaxPageSize());
        int requested = pageSize == null ? pagination.getDefaultPageSize() : pageSize;
        return Math.min(Math.max(1, requested), max);
    }

    private Movie findExisting(long id) {
        return movieStore.findById(id).orElseThrow(() -> {
            log.debug("Movie {} not found", id);
            return new EntityNotFoundException(ENTITY_NAME, id);
        });
    }

    private void replaceExisting(long id, Movie movie) {
        if (!movieStore.replace(id, movie)) {
            throw new EntityNotFoundException(ENTITY_NAME, id);
        }
    }

    private <R> R withIdLock(long id, Supplier<R> work) {
        Lock lock = idLocks.get(id);
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
