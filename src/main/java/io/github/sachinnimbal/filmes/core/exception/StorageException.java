package io.github.sachinnimbal.filmes.core.exception;

/**
 * Failure of the persistence backend. Never retried; surfaced to clients as a bare 500.
 */
public class StorageException extends FilmesException {
    public StorageException(String message, Throwable cause) {
        super("STORAGE_ERROR", message, cause);
    }
}
