package io.github.sachinnimbal.filmes.web;

import io.github.sachinnimbal.filmes.core.response.PageResponse;
import io.github.sachinnimbal.filmes.dto.CreateMovieRequest;
import io.github.sachinnimbal.filmes.dto.MoviePatch;
import io.github.sachinnimbal.filmes.dto.MovieResponse;
import io.github.sachinnimbal.filmes.dto.UpdateMovieRequest;
import io.github.sachinnimbal.filmes.service.MovieService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;
import java.util.Map;

/**
 * Thin HTTP binding of {@link MovieService}: parses the request, delegates, picks the status code.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("${filmes.api.base-path:/resource}")
@Tag(name = "Movies", description = "Paginated CRUD over the movie catalogue")
public class MovieController {

    private final MovieService movieService;

    @PostMapping
    @Operation(summary = "Register a movie")
    @ApiResponse(responseCode = "201", description = "Created; Location points at the new movie")
    @ApiResponse(responseCode = "400", description = "Validation failed")
    public ResponseEntity<MovieResponse> create(@RequestBody CreateMovieRequest request) {
        MovieResponse created = movieService.create(request);

        URI location = ServletUriComponentsBuilder.fromCurrentRequest()
                .path("/{id}")
                .buildAndExpand(created.getId())
                .toUri();

        return ResponseEntity.created(location).body(created);
    }

    @GetMapping
    @Operation(summary = "List movies one page at a time, in insertion order")
    public PageResponse<MovieResponse> list(
            @Parameter(description = "1-based page number, default 1")
            @RequestParam(required = false) Integer page,
            @Parameter(description = "Movies per page, default from configuration")
            @RequestParam(required = false) Integer pageSize) {
        return movieService.list(page, pageSize);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Fetch one movie")
    @ApiResponse(responseCode = "200", description = "Found")
    @ApiResponse(responseCode = "404", description = "No movie with this id")
    public MovieResponse getById(@PathVariable long id) {
        return movieService.getById(id);
    }

    @PutMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Replace every mutable field of a movie")
    @ApiResponse(responseCode = "204", description = "Replaced")
    @ApiResponse(responseCode = "400", description = "Validation failed")
    @ApiResponse(responseCode = "404", description = "No movie with this id")
    public void updateFull(@PathVariable long id, @RequestBody UpdateMovieRequest request) {
        movieService.updateFull(id, request);
    }

    @PatchMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Change only the fields present in the body")
    @ApiResponse(responseCode = "204", description = "Patched")
    @ApiResponse(responseCode = "400", description = "Unknown field, wrong type or invalid value")
    @ApiResponse(responseCode = "404", description = "No movie with this id")
    public void updatePartial(@PathVariable long id, @RequestBody Map<String, Object> updates) {
        movieService.updatePartial(id, MoviePatch.from(updates));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Remove a movie")
    @ApiResponse(responseCode = "204", description = "Deleted")
    @ApiResponse(responseCode = "404", description = "No movie with this id")
    public void delete(@PathVariable long id) {
        movieService.delete(id);
    }
}
