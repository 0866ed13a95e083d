package io.github.sachinnimbal.filmes.web;

import io.github.sachinnimbal.filmes.core.config.FilmesJacksonConfiguration;
import io.github.sachinnimbal.filmes.core.enums.LengthCategory;
import io.github.sachinnimbal.filmes.core.exception.ConflictException;
import io.github.sachinnimbal.filmes.core.exception.EntityNotFoundException;
import io.github.sachinnimbal.filmes.core.exception.StorageException;
import io.github.sachinnimbal.filmes.core.exception.ValidationException;
import io.github.sachinnimbal.filmes.core.response.PageResponse;
import io.github.sachinnimbal.filmes.dto.CreateMovieRequest;
import io.github.sachinnimbal.filmes.dto.MoviePatch;
import io.github.sachinnimbal.filmes.dto.MovieResponse;
import io.github.sachinnimbal.filmes.dto.UpdateMovieRequest;
import io.github.sachinnimbal.filmes.service.MovieService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MovieController.class)
@Import(FilmesJacksonConfiguration.class)
class MovieControllerTest {

    private static final String MOVIE_JSON = """
            {"title":"Central do Brasil","genre":"Drama","durationMinutes":113,"director":"Walter Salles"}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MovieService movieService;

    private static MovieResponse response(long id) {
        return MovieResponse.builder()
                .id(id)
                .title("Central do Brasil")
                .genre("Drama")
                .durationMinutes(113)
                .director("Walter Salles")
                .createdAt(LocalDateTime.of(2025, 1, 15, 10, 0))
                .updatedAt(LocalDateTime.of(2025, 1, 15, 10, 0))
                .lengthCategory(LengthCategory.FEATURE)
                .runtime("1h 53m")
                .build();
    }

    @Test
    void createReturns201WithLocationAndBody() throws Exception {
        when(movieService.create(any(CreateMovieRequest.class))).thenReturn(response(1L));

        mockMvc.perform(post("/resource").contentType(MediaType.APPLICATION_JSON).content(MOVIE_JSON))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", endsWith("/resource/1")))
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.title").value("Central do Brasil"))
                .andExpect(jsonPath("$.lengthCategory").value("FEATURE"))
                .andExpect(jsonPath("$.runtime").value("1h 53m"))
                .andExpect(jsonPath("$.description").value(nullValue()));
    }

    @Test
    void createWithInvalidFieldsReturns400WithFieldErrors() throws Exception {
        when(movieService.create(any(CreateMovieRequest.class))).thenThrow(new ValidationException(
                "Validation failed: title", Map.of("title", "must not be blank")));

        mockMvc.perform(post("/resource").contentType(MediaType.APPLICATION_JSON).content("{\"title\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.data.title").value("must not be blank"))
                .andExpect(jsonPath("$.path").value("/resource"));
    }

    @Test
    void malformedJsonIsRejectedBeforeTheService() throws Exception {
        mockMvc.perform(post("/resource").contentType(MediaType.APPLICATION_JSON).content("{\"title\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST_BODY"));

        verifyNoInteractions(movieService);
    }

    @Test
    void fractionalDurationIsRejectedOnCreate() throws Exception {
        mockMvc.perform(post("/resource").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Alien\",\"genre\":\"Horror\",\"durationMinutes\":120.9}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.data.durationMinutes").value("must be a whole number"));

        verifyNoInteractions(movieService);
    }

    @Test
    void numericTitleIsRejectedOnCreate() throws Exception {
        mockMvc.perform(post("/resource").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":123,\"genre\":\"Drama\",\"durationMinutes\":120}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.data.title").value("must be a string"));

        verifyNoInteractions(movieService);
    }

    @Test
    void quotedDurationIsRejectedOnReplace() throws Exception {
        mockMvc.perform(put("/resource/1").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Alien\",\"genre\":\"Horror\",\"durationMinutes\":\"130\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.data.durationMinutes").value("must be a number"));

        verifyNoInteractions(movieService);
    }

    @Test
    void fractionalDurationIsRejectedOnReplace() throws Exception {
        mockMvc.perform(put("/resource/1").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Alien\",\"genre\":\"Horror\",\"durationMinutes\":120.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data.durationMinutes").value("must be a whole number"));

        verifyNoInteractions(movieService);
    }

    @Test
    void nonJsonContentTypeIs415() throws Exception {
        mockMvc.perform(post("/resource").contentType(MediaType.TEXT_PLAIN).content("hello"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.error.code").value("UNSUPPORTED_MEDIA_TYPE"));

        mockMvc.perform(patch("/resource/1").contentType(MediaType.TEXT_PLAIN).content("hello"))
                .andExpect(status().isUnsupportedMediaType());

        verifyNoInteractions(movieService);
    }

    @Test
    void nonJsonAcceptHeaderIs406() throws Exception {
        when(movieService.getById(1L)).thenReturn(response(1L));

        mockMvc.perform(get("/resource/1").accept(MediaType.APPLICATION_XML))
                .andExpect(status().isNotAcceptable())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.error.code").value("NOT_ACCEPTABLE"));
    }

    @Test
    void unsupportedMethodIs405() throws Exception {
        mockMvc.perform(delete("/resource"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.error.code").value("METHOD_NOT_ALLOWED"));

        mockMvc.perform(post("/resource/1").contentType(MediaType.APPLICATION_JSON).content(MOVIE_JSON))
                .andExpect(status().isMethodNotAllowed());

        verifyNoInteractions(movieService);
    }

    @Test
    void unknownPathIs404() throws Exception {
        mockMvc.perform(get("/nothing-here"))
                .andExpect(status().isNotFound());

        verifyNoInteractions(movieService);
    }

    @Test
    void listPassesPaginationParameters() throws Exception {
        PageResponse<MovieResponse> page = PageResponse.from(
                new PageImpl<>(List.of(response(6L)), PageRequest.of(1, 5), 6));
        when(movieService.list(2, 5)).thenReturn(page);

        mockMvc.perform(get("/resource").param("page", "2").param("pageSize", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].id").value(6))
                .andExpect(jsonPath("$.page").value(2))
                .andExpect(jsonPath("$.pageSize").value(5))
                .andExpect(jsonPath("$.total").value(6))
                .andExpect(jsonPath("$.totalPages").value(2));
    }

    @Test
    void listWithoutParametersLeavesDefaultsToTheService() throws Exception {
        when(movieService.list(null, null)).thenReturn(PageResponse.from(
                new PageImpl<MovieResponse>(List.of(), PageRequest.of(0, 10), 0)));

        mockMvc.perform(get("/resource"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items").isEmpty())
                .andExpect(jsonPath("$.total").value(0));

        verify(movieService).list(isNull(), isNull());
    }

    @Test
    void nonNumericPageIsATypeMismatch() throws Exception {
        mockMvc.perform(get("/resource").param("page", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("TYPE_MISMATCH"));

        verifyNoInteractions(movieService);
    }

    @Test
    void getByIdReturnsMovie() throws Exception {
        when(movieService.getById(1L)).thenReturn(response(1L));

        mockMvc.perform(get("/resource/1"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.director").value("Walter Salles"))
                .andExpect(jsonPath("$.createdAt").value("2025-01-15 10:00:00"));
    }

    @Test
    void getUnknownIdReturns404() throws Exception {
        when(movieService.getById(42L)).thenThrow(new EntityNotFoundException("Movie", 42L));

        mockMvc.perform(get("/resource/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("ENTITY_NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Movie not found with id: 42"));
    }

    @Test
    void nonNumericIdIsATypeMismatch() throws Exception {
        mockMvc.perform(get("/resource/abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("TYPE_MISMATCH"));
    }

    @Test
    void putReturns204() throws Exception {
        mockMvc.perform(put("/resource/1").contentType(MediaType.APPLICATION_JSON).content(MOVIE_JSON))
                .andExpect(status().isNoContent())
                .andExpect(content().string(""));

        verify(movieService).updateFull(eq(1L), any(UpdateMovieRequest.class));
    }

    @Test
    void putUnknownIdReturns404() throws Exception {
        doThrow(new EntityNotFoundException("Movie", 9L))
                .when(movieService).updateFull(eq(9L), any(UpdateMovieRequest.class));

        mockMvc.perform(put("/resource/9").contentType(MediaType.APPLICATION_JSON).content(MOVIE_JSON))
                .andExpect(status().isNotFound());
    }

    @Test
    void patchForwardsOnlyPresentFields() throws Exception {
        mockMvc.perform(patch("/resource/1").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"durationMinutes\":170,\"description\":null}"))
                .andExpect(status().isNoContent());

        ArgumentCaptor<MoviePatch> captor = ArgumentCaptor.forClass(MoviePatch.class);
        verify(movieService).updatePartial(eq(1L), captor.capture());
        MoviePatch sent = captor.getValue();
        assertThat(sent.presentFields()).containsExactly("durationMinutes", "description");
        assertThat(sent.getDurationMinutes().getValue()).isEqualTo(170);
        assertThat(sent.getDescription().getValue()).isNull();
        assertThat(sent.getTitle().isPresent()).isFalse();
    }

    @Test
    void patchWithUnknownFieldReturns400() throws Exception {
        mockMvc.perform(patch("/resource/1").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\":5,\"id\":7}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.data.rating").value("does not exist"))
                .andExpect(jsonPath("$.data.id").value("cannot be updated"));

        verifyNoInteractions(movieService);
    }

    @Test
    void patchWithEmptyObjectReturns400() throws Exception {
        mockMvc.perform(patch("/resource/1").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(movieService);
    }

    @Test
    void deleteReturns204ThenNotFound() throws Exception {
        mockMvc.perform(delete("/resource/3"))
                .andExpect(status().isNoContent());

        doThrow(new EntityNotFoundException("Movie", 3L)).when(movieService).delete(3L);

        mockMvc.perform(delete("/resource/3"))
                .andExpect(status().isNotFound());
    }

    @Test
    void conflictReturns409() throws Exception {
        doThrow(new ConflictException("Movie 4 was changed concurrently"))
                .when(movieService).updateFull(eq(4L), any(UpdateMovieRequest.class));

        mockMvc.perform(put("/resource/4").contentType(MediaType.APPLICATION_JSON).content(MOVIE_JSON))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("CONFLICT"));
    }

    @Test
    void storageFailureReturns500WithoutDetails() throws Exception {
        when(movieService.getById(1L))
                .thenThrow(new StorageException("Failed to find movie 1", new RuntimeException("connection reset")));

        mockMvc.perform(get("/resource/1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error.code").value("STORAGE_ERROR"))
                .andExpect(jsonPath("$.error.details").doesNotExist())
                .andExpect(jsonPath("$.message").value(
                        "An unexpected error occurred. Please contact support if the problem persists"));
    }
}
