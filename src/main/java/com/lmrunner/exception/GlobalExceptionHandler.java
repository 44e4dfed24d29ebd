package com.lmrunner.exception;

import com.lmrunner.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;

import java.time.Instant;

/**
 * Maps runner errors to HTTP responses with an {@code {error, message}} body.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(LanguageModelException.class)
    public ResponseEntity<ErrorResponse> handleLanguageModelException(
            LanguageModelException ex,
            ServerWebExchange exchange
    ) {
        HttpStatus status = statusOf(ex);
        if (status.is5xxServerError()) {
            log.error("Provider call failed: {}", ex.getMessage());
        } else {
            log.warn("Request rejected with {}: {}", ex.getKind(), ex.getMessage());
        }

        ErrorResponse body = toErrorResponse(ex);
        body.setStatus(status.value());
        body.setPath(exchange.getRequest().getPath().value());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(
            WebExchangeBindException ex,
            ServerWebExchange exchange
    ) {
        StringBuilder errors = new StringBuilder();
        ex.getBindingResult().getFieldErrors().forEach((FieldError error) ->
                errors.append(error.getField()).append(": ").append(error.getDefaultMessage()).append("; "));

        ErrorResponse body = ErrorResponse.builder()
                .error(ErrorKind.INVALID_FORMAT.name())
                .message("Validation failed: " + errors)
                .status(HttpStatus.BAD_REQUEST.value())
                .timestamp(Instant.now())
                .path(exchange.getRequest().getPath().value())
                .build();
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            ServerWebExchange exchange
    ) {
        log.error("Unexpected error", ex);

        ErrorResponse body = ErrorResponse.builder()
                .error("INTERNAL")
                .message(ex.getMessage())
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .timestamp(Instant.now())
                .path(exchange.getRequest().getPath().value())
                .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    /**
     * HTTP status for a runner error. A provider's own 4xx is passed through.
     */
    public static HttpStatus statusOf(LanguageModelException ex) {
        switch (ex.getKind()) {
            case INVALID_FORMAT:
            case UNKNOWN_PROVIDER:
                return HttpStatus.BAD_REQUEST;
            case MISSING_CREDENTIAL:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case BACKEND_REJECTED:
                int providerStatus = ((BackendRejectedException) ex).getStatus();
                if (providerStatus >= 400 && providerStatus < 500) {
                    HttpStatus resolved = HttpStatus.resolve(providerStatus);
                    return resolved != null ? resolved : HttpStatus.BAD_GATEWAY;
                }
                return HttpStatus.BAD_GATEWAY;
            case SINK_CLOSED:
                return HttpStatus.CONFLICT;
            case BACKEND_UNAVAILABLE:
            default:
                return HttpStatus.BAD_GATEWAY;
        }
    }

    /**
     * Error body shared by JSON responses and SSE {@code error} events.
     */
    public static ErrorResponse toErrorResponse(Throwable error) {
        String kind = error instanceof LanguageModelException
                ? ((LanguageModelException) error).getKind().name()
                : "INTERNAL";
        return ErrorResponse.builder()
                .error(kind)
                .message(error.getMessage())
                .timestamp(Instant.now())
                .build();
    }
}
