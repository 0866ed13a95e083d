package io.github.sachinnimbal.filmes.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.github.sachinnimbal.filmes.core.enums.LengthCategory;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Movie as returned to clients")
public class MovieResponse {
    private Long id;
    private String title;
    private String genre;
    private Integer durationMinutes;
    private String director;
    private String description;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime createdAt;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime updatedAt;

    // computed at read time, never stored
    @Schema(accessMode = Schema.AccessMode.READ_ONLY)
    private LengthCategory lengthCategory;

    @Schema(accessMode = Schema.AccessMode.READ_ONLY, example = "2h 15m")
    private String runtime;
}
