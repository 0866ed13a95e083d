package io.github.sachinnimbal.filmes.core.exception;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import io.github.sachinnimbal.filmes.core.response.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps service failures to status codes and the {@link ApiResponse} error envelope.
 * Client mistakes are answered with a 4xx and logged at WARN; only server-side failures become a 500,
 * logged with their stack trace but reported to the client without detail.
 */
@Slf4j
@RestControllerAdvice
public class FilmesExceptionHandler {

    private static final String INTERNAL_ERROR_MESSAGE =
            "An unexpected error occurred. Please contact support if the problem persists";

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiResponse<Map<String, String>>> handleValidation(
            ValidationException ex, HttpServletRequest request) {

        log.warn("Validation failed: {} {} -> {}", request.getMethod(), request.getRequestURI(), ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.validationError(ex.getMessage(), ex.getFieldErrors())
                        .withPath(request.getRequestURI()));
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleEntityNotFound(
            EntityNotFoundException ex, HttpServletRequest request) {

        log.warn("Entity not found: {}", ex.getMessage());

        return clientError(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiResponse<Void>> handleConflict(
            ConflictException ex, HttpServletRequest request) {

        log.warn("Conflict: {}", ex.getMessage());

        return clientError(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ApiResponse<Void>> handleStorage(
            StorageException ex, HttpServletRequest request) {

        log.error("Storage error on {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        return internalError(ex.getErrorCode(), request);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiResponse<Void>> handleDataAccessException(
            DataAccessException ex, HttpServletRequest request) {

        log.error("Data access error on {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        return internalError("DATABASE_ERROR", request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Map<String, String>>> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {

        log.warn("Message not readable: {}", ex.getMessage());

        // A well-formed body with a value of the wrong JSON type is a field error, as it is for PATCH
        if (ex.getMostSpecificCause() instanceof MismatchedInputException mismatch && !mismatch.getPath().isEmpty()) {
            String field = fieldPath(mismatch);
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(ApiResponse.validationError("Invalid data type in request body: " + field,
                                    Map.of(field, expectedType(mismatch)))
                            .withPath(request.getRequestURI()));
        }

        String message = "Invalid request body format";
        String details = ex.getMostSpecificCause().getMessage();

        if (details != null) {
            if (details.contains("Cannot deserialize") || details.contains("type")) {
                message = "Invalid data type in request body";
            } else if (details.contains("JSON")) {
                message = "Invalid JSON format in request body";
            }
        }

        return clientError(HttpStatus.BAD_REQUEST, "INVALID_REQUEST_BODY", message, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleMethodArgumentTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {

        log.warn("Type mismatch: {}", ex.getMessage());

        String message = String.format("Invalid value '%s' for parameter '%s'. Expected type: %s",
                ex.getValue(),
                ex.getName(),
                ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown");

        return clientError(HttpStatus.BAD_REQUEST, "TYPE_MISMATCH", message, request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingServletRequestParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {

        log.warn("Missing parameter: {}", ex.getMessage());

        String message = String.format("Required parameter '%s' of type %s is missing",
                ex.getParameterName(), ex.getParameterType());

        return clientError(HttpStatus.BAD_REQUEST, "MISSING_PARAMETER", message, request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleHttpRequestMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {

        log.warn("Method not supported: {}", ex.getMessage());

        String message = String.format("HTTP method '%s' is not supported for this endpoint. Supported methods: %s",
                ex.getMethod(),
                ex.getSupportedHttpMethods());

        return clientError(HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED", message, request);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleHttpMediaTypeNotSupported(
            HttpMediaTypeNotSupportedException ex, HttpServletRequest request) {

        log.warn("Media type not supported: {}", ex.getMessage());

        String message = String.format("Content type '%s' is not supported. Supported content types: %s",
                ex.getContentType(),
                ex.getSupportedMediaTypes());

        return clientError(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "UNSUPPORTED_MEDIA_TYPE", message, request);
    }

    @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
    public ResponseEntity<ApiResponse<Void>> handleHttpMediaTypeNotAcceptable(
            HttpMediaTypeNotAcceptableException ex, HttpServletRequest request) {

        log.warn("Media type not acceptable: {}", ex.getMessage());

        String message = "Responses are only available as " + MediaType.APPLICATION_JSON_VALUE;

        // The client's Accept header excludes JSON, so the content type is fixed instead of negotiated
        return ResponseEntity.status(HttpStatus.NOT_ACCEPTABLE)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ApiResponse.<Void>error(
                        message,
                        HttpStatus.NOT_ACCEPTABLE,
                        "NOT_ACCEPTABLE",
                        message
                ).withPath(request.getRequestURI()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResourceFound(
            NoResourceFoundException ex, HttpServletRequest request) {

        log.warn("No endpoint: {} {}", request.getMethod(), request.getRequestURI());

        String message = String.format("No endpoint %s %s", request.getMethod(), request.getRequestURI());
        return clientError(HttpStatus.NOT_FOUND, "RESOURCE_NOT_FOUND", message, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGlobalException(
            Exception ex, HttpServletRequest request) {

        log.error("Unexpected error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return internalError("INTERNAL_SERVER_ERROR", request);
    }

    private <T> ResponseEntity<ApiResponse<T>> clientError(HttpStatus status, String errorCode, String message,
                                                          HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(ApiResponse.<T>error(
                        message,
                        status,
                        errorCode,
                        message
                ).withPath(request.getRequestURI()));
    }

    private ResponseEntity<ApiResponse<Void>> internalError(String errorCode, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.<Void>error(
                        INTERNAL_ERROR_MESSAGE,
                        HttpStatus.INTERNAL_SERVER_ERROR,
                        errorCode,
                        null
                ).withPath(request.getRequestURI()));
    }

    private static String fieldPath(MismatchedInputException ex) {
        return ex.getPath().stream()
                .map(FilmesExceptionHandler::segment)
                .collect(Collectors.joining("."));
    }

    private static String segment(JsonMappingException.Reference reference) {
        return reference.getFieldName() != null ? reference.getFieldName() : "[" + reference.getIndex() + "]";
    }

    private static String expectedType(MismatchedInputException ex) {
        Class<?> target = ex.getTargetType();
        if (target == String.class) {
            return "must be a string";
        }
        if (target == Integer.class || target == int.class) {
            boolean numeric = ex instanceof InvalidFormatException invalid && invalid.getValue() instanceof Number;
            return numeric ? "must be a whole number" : "must be a number";
        }
        return "has the wrong type";
    }
}
