package io.github.sachinnimbal.filmes.dto;

import io.github.sachinnimbal.filmes.core.model.Movie;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Fields supplied by the client to register a movie")
public class CreateMovieRequest {

    @NotBlank
    @Size(max = Movie.TITLE_MAX_LENGTH)
    private String title;

    @NotBlank
    @Size(max = Movie.GENRE_MAX_LENGTH)
    private String genre;

    @NotNull
    @Min(Movie.MIN_DURATION_MINUTES)
    @Max(Movie.MAX_DURATION_MINUTES)
    @Schema(description = "Running time in minutes", example = "120")
    private Integer durationMinutes;

    @Size(max = Movie.DIRECTOR_MAX_LENGTH)
    private String director;

    @Size(max = Movie.DESCRIPTION_MAX_LENGTH)
    private String description;
}
