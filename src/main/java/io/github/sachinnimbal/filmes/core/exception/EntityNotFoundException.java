package io.github.sachinnimbal.filmes.core.exception;

public class EntityNotFoundException extends FilmesException {
    public EntityNotFoundException(String entityName, Object id) {
        super("ENTITY_NOT_FOUND", String.format("%s not found with id: %s", entityName, id));
    }
}
