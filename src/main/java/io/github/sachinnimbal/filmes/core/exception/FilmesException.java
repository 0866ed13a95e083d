package io.github.sachinnimbal.filmes.core.exception;

import lombok.Getter;

/**
 * Base type of the errors the movie service reports to its callers.
 */
@Getter
public abstract class FilmesException extends RuntimeException {

    private final String errorCode;

    protected FilmesException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected FilmesException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
