package com.graphmem.core.service.api.advice;

import com.graphmem.core.service.api.dto.ApiResponse;
import com.graphmem.core.service.error.AlreadyCommittedException;
import com.graphmem.core.service.error.GeneratorException;
import com.graphmem.core.service.error.InvalidStateException;
import com.graphmem.core.service.error.MemoryServiceException;
import com.graphmem.core.service.error.NoMessagesException;
import com.graphmem.core.service.error.NotFoundException;
import com.graphmem.core.service.error.StorageUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Global exception handler for REST controllers.
 *
 * Maps the memory service error taxonomy onto HTTP statuses inside the
 * standard response envelope.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(
            MethodArgumentNotValidException ex) {

        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", details);

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Validation failed", "VALIDATION_ERROR", details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Malformed request body", "VALIDATION_ERROR"));
    }

    /**
     * Handles the memory service error taxonomy.
     */
    @ExceptionHandler(MemoryServiceException.class)
    public ResponseEntity<ApiResponse<Void>> handleMemoryServiceException(MemoryServiceException ex) {
        HttpStatus status = switch (ex.getErrorCode()) {
            case NoMessagesException.CODE, NotFoundException.CODE -> HttpStatus.NOT_FOUND;
            case InvalidStateException.CODE, AlreadyCommittedException.CODE -> HttpStatus.CONFLICT;
            case StorageUnavailableException.CODE -> HttpStatus.SERVICE_UNAVAILABLE;
            case GeneratorException.CODE -> HttpStatus.BAD_GATEWAY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };

        if (status.is5xxServerError()) {
            log.error("Memory service error: {} [{}]", ex.getMessage(), ex.getErrorCode());
        } else {
            log.warn("Request rejected: {} [{}]", ex.getMessage(), ex.getErrorCode());
        }

        return ResponseEntity.status(status).body(ApiResponse.error(ex));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResourceFoundException(
            NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("Resource not found", "NOT_FOUND"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgumentException(
            IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error(ex.getMessage(), "INVALID_ARGUMENT"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(
                        "An unexpected error occurred",
                        "INTERNAL_ERROR",
                        ex.getMessage()
                ));
    }
}
