package com.z254.lumina.tutor.api;

import com.z254.lumina.tutor.adaptive.AdaptiveContentException;
import com.z254.lumina.tutor.api.dto.ApiError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Maps exceptions from the REST layer to {@link ApiError} bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiError> handleValidation(WebExchangeBindException ex, ServerWebExchange exchange) {
        String message = ex.getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, message, ex, exchange);
    }

    @ExceptionHandler({ServerWebInputException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception ex, ServerWebExchange exchange) {
        String message = ex instanceof ServerWebInputException input ? input.getReason() : ex.getMessage();
        return error(HttpStatus.BAD_REQUEST, message, ex, exchange);
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiError> handleNotFound(NoSuchElementException ex, ServerWebExchange exchange) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage(), ex, exchange);
    }

    @ExceptionHandler(AdaptiveContentException.class)
    public ResponseEntity<ApiError> handleGenerationFailure(AdaptiveContentException ex, ServerWebExchange exchange) {
        return error(HttpStatus.BAD_GATEWAY, ex.getMessage(), ex, exchange);
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String message, Exception ex,
                                                  ServerWebExchange exchange) {
        String path = exchange.getRequest().getPath().value();
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, status={}, errorMessage={}",
                path,
                exchange.getRequest().getMethod(),
                ex.getClass().getSimpleName(),
                status.value(),
                message);
        return ResponseEntity.status(status)
                .body(new ApiError(status.value(), status.getReasonPhrase(), message, path, Instant.now()));
    }
}
