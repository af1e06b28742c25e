package com.flagship.marketplace.error;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures to {@link ApiError} responses.
 *
 * Marketplace errors keep their message so the caller sees the exact
 * precondition that failed. Storage outages become a retryable 503.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MarketplaceException.class)
    public ResponseEntity<ApiError> handleMarketplaceException(MarketplaceException e) {
        if (e.getKind() == ErrorKind.UNAVAILABLE) {
            log.error("Operation unavailable: {}", e.getMessage(), e);
        } else {
            log.warn("Rejected request [{}]: {}", e.getKind(), e.getMessage());
        }
        return respond(e.getKind(), e.getMessage(), null);
    }

    @ExceptionHandler({
        CannotCreateTransactionException.class,
        DataAccessResourceFailureException.class,
        QueryTimeoutException.class
    })
    public ResponseEntity<ApiError> handleStorageUnavailable(Exception e) {
        log.error("Storage unavailable: {}", e.getMessage());
        return respond(ErrorKind.UNAVAILABLE, "Storage is temporarily unavailable, retry later", null);
    }

    /**
     * A concurrent request won a unique key or a versioned write at flush or commit time.
     */
    @ExceptionHandler({
        DataIntegrityViolationException.class,
        OptimisticLockingFailureException.class
    })
    public ResponseEntity<ApiError> handleConcurrentWrite(Exception e) {
        log.warn("Concurrent write conflict: {}", e.getMessage());
        return respond(ErrorKind.VERSION_CONFLICT,
                "The request conflicted with a concurrent change, re-read and retry", null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(ErrorKind.VALIDATION_ERROR,
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(ErrorKind.VALIDATION_ERROR, "Request validation failed", errors);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        MissingServletRequestPartException.class
    })
    public ResponseEntity<ApiError> handleMalformedRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return respond(ErrorKind.VALIDATION_ERROR, "Malformed request: " + e.getMessage(), null);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiError> handleUploadTooLarge(MaxUploadSizeExceededException e) {
        log.warn("Upload rejected: {}", e.getMessage());
        return respond(ErrorKind.VALIDATION_ERROR, "Uploaded file is too large", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.builder()
            .error("INTERNAL_ERROR")
            .message("An unexpected error occurred")
            .retryable(false)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ApiError> respond(ErrorKind kind, String message, Map<String, String> details) {
        ApiError error = ApiError.builder()
            .error(kind.name())
            .message(message)
            .retryable(kind.isRetryable())
            .details(details)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(kind.getHttpStatus()).body(error);
    }
}
