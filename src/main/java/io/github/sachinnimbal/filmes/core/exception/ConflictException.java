package io.github.sachinnimbal.filmes.core.exception;

/**
 * Reserved for state conflicts. No current operation raises it.
 */
public class ConflictException extends FilmesException {
    public ConflictException(String message) {
        super("CONFLICT", message);
    }
}
