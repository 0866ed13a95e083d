package io.github.sachinnimbal.filmes.core.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * Persisted movie record. Owned by the {@code MovieStore}; everything outside the store
 * works on detached copies obtained through {@link #copy()}.
 */
@Data
@Entity
@Table(name = "movies")
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Movie implements Serializable {

    public static final int TITLE_MAX_LENGTH = 200;
    public static final int GENRE_MAX_LENGTH = 50;
    public static final int DIRECTOR_MAX_LENGTH = 100;
    public static final int DESCRIPTION_MAX_LENGTH = 1000;
    public static final int MIN_DURATION_MINUTES = 70;
    public static final int MAX_DURATION_MINUTES = 600;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(max = TITLE_MAX_LENGTH)
    @Column(nullable = false, length = TITLE_MAX_LENGTH)
    private String title;

    @NotBlank
    @Size(max = GENRE_MAX_LENGTH)
    @Column(nullable = false, length = GENRE_MAX_LENGTH)
    private String genre;

    @NotNull
    @Min(MIN_DURATION_MINUTES)
    @Max(MAX_DURATION_MINUTES)
    @Column(nullable = false)
    private Integer durationMinutes;

    @Size(max = DIRECTOR_MAX_LENGTH)
    @Column(length = DIRECTOR_MAX_LENGTH)
    private String director;

    @Size(max = DESCRIPTION_MAX_LENGTH)
    @Column(length = DESCRIPTION_MAX_LENGTH)
    private String description;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public Movie copy() {
        return toBuilder().build();
    }

    public void onCreate(LocalDateTime now) {
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    public void onUpdate(LocalDateTime now) {
        this.updatedAt = now;
    }
}
