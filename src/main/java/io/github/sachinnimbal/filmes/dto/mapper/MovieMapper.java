package io.github.sachinnimbal.filmes.dto.mapper;

import io.github.sachinnimbal.filmes.core.enums.LengthCategory;
import io.github.sachinnimbal.filmes.core.model.Movie;
import io.github.sachinnimbal.filmes.core.util.TimeUtils;
import io.github.sachinnimbal.filmes.dto.CreateMovieRequest;
import io.github.sachinnimbal.filmes.dto.MoviePatch;
import io.github.sachinnimbal.filmes.dto.MovieResponse;
import io.github.sachinnimbal.filmes.dto.UpdateMovieRequest;
import io.github.sachinnimbal.filmes.service.impl.helper.FilmesValidationHelper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Translates between the wire DTOs and {@link Movie}. Every method returns a new object and leaves
 * its arguments untouched.
 */
@Component
@RequiredArgsConstructor
public class MovieMapper {

    private final FilmesValidationHelper validationHelper;

    /**
     * Id and audit timestamps are left unset; the service and the store fill them in.
     */
    public Movie fromCreateRequest(CreateMovieRequest request) {
        return Movie.builder()
                .title(request.getTitle())
                .genre(request.getGenre())
                .durationMinutes(request.getDurationMinutes())
                .director(request.getDirector())
                .description(request.getDescription())
                .build();
    }

    public MovieResponse toResponse(Movie movie) {
        return MovieResponse.builder()
                .id(movie.getId())
                .title(movie.getTitle())
                .genre(movie.getGenre())
                .durationMinutes(movie.getDurationMinutes())
                .director(movie.getDirector())
                .description(movie.getDescription())
                .createdAt(movie.getCreatedAt())
                .updatedAt(movie.getUpdatedAt())
                .lengthCategory(LengthCategory.of(movie.getDurationMinutes()))
                .runtime(TimeUtils.formatRuntime(movie.getDurationMinutes()))
                .build();
    }

    /**
     * Replacement entity built only from the request; id and audit timestamps come from the original.
     */
    public Movie applyFullUpdate(Movie original, UpdateMovieRequest request) {
        return Movie.builder()
                .id(original.getId())
                .createdAt(original.getCreatedAt())
                .updatedAt(original.getUpdatedAt())
                .title(request.getTitle())
                .genre(request.getGenre())
                .durationMinutes(request.getDurationMinutes())
                .director(request.getDirector())
                .description(request.getDescription())
                .build();
    }

    /**
     * Copy of the original with every present patch field overwritten.
     *
     * @throws io.github.sachinnimbal.filmes.core.exception.ValidationException when the merged movie
     *         breaks a field constraint
     */
    public Movie applyPatch(Movie original, MoviePatch patch) {
        Movie.MovieBuilder builder = original.toBuilder();
        patch.getTitle().ifPresent(builder::title);
        patch.getGenre().ifPresent(builder::genre);
        patch.getDurationMinutes().ifPresent(builder::durationMinutes);
        patch.getDirector().ifPresent(builder::director);
        patch.getDescription().ifPresent(builder::description);

        Movie patched = builder.build();
        validationHelper.validateJakartaConstraints(patched);
        return patched;
    }
}
