package com.prediction.worthhub.worth_hub.error;

import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.prediction.worthhub.worth_hub.dto.ErrorResponse;

import lombok.extern.slf4j.Slf4j;

/**
 * Renders failures as {@code {error, category, message}}.
 */
@RestControllerAdvice
@Slf4j
public class RestExceptionHandler {

    private static final String INVALID_ARGUMENT = "InvalidArgument";

    @ExceptionHandler(WorthHubException.class)
    public ResponseEntity<ErrorResponse> handleWorthHub(WorthHubException ex) {
        log.warn("Instruction rejected: {} ({})", ex.getCode(), ex.getMessage());
        ErrorResponse error = ErrorResponse.builder()
                .error(ex.getCode().name())
                .category(ex.getCategory().name())
                .message(ex.getMessage())
                .build();
        return ResponseEntity.status(ex.getCategory().getHttpStatus()).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Invalid request: {}", message);
        return badRequest(message);
    }

    @ExceptionHandler({ IllegalArgumentException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class })
    public ResponseEntity<ErrorResponse> handleMalformed(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleInternal(IllegalStateException ex) {
        log.error("Ledger invariant violated", ex);
        ErrorResponse error = ErrorResponse.builder()
                .error("InternalError")
                .category("INTERNAL")
                .message(ex.getMessage())
                .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private static ResponseEntity<ErrorResponse> badRequest(String message) {
        ErrorResponse error = ErrorResponse.builder()
                .error(INVALID_ARGUMENT)
                .category(ErrorCategory.VALIDATION.name())
                .message(message)
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }
}
