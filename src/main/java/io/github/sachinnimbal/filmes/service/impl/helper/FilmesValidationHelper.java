package io.github.sachinnimbal.filmes.service.impl.helper;

import io.github.sachinnimbal.filmes.core.exception.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs Jakarta Bean Validation and turns violations into a {@link ValidationException}
 * with one message per property path.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FilmesValidationHelper {

    private final Validator validator;

    public <T> void validateJakartaConstraints(T target) {
        if (target == null) {
            throw new ValidationException("Request body cannot be null");
        }

        Set<ConstraintViolation<T>> violations = validator.validate(target);
        if (violations.isEmpty()) {
            return;
        }

        Map<String, String> errors = violations.stream()
                .sorted(Comparator.comparing((ConstraintViolation<T> v) -> v.getPropertyPath().toString())
                        .thenComparing(ConstraintViolation::getMessage))
                .collect(Collectors.toMap(
                        v -> v.getPropertyPath().toString(),
                        ConstraintViolation::getMessage,
                        (first, second) -> first + "; " + second,
                        LinkedHashMap::new));

        String summary = errors.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(", "));

        log.debug("Validation failed for {}: {}", target.getClass().getSimpleName(), summary);
        throw new ValidationException("Validation failed: " + summary, errors);
    }
}
