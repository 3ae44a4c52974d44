package com.flagship.tenant_ledger.api.exception;

import com.flagship.tenant_ledger.ledger.exception.AccountInUseException;
import com.flagship.tenant_ledger.ledger.exception.AssetNotFoundException;
import com.flagship.tenant_ledger.ledger.exception.BooksUnbalancedException;
import com.flagship.tenant_ledger.ledger.exception.DuplicateAccountException;
import com.flagship.tenant_ledger.ledger.exception.DuplicateDocumentException;
import com.flagship.tenant_ledger.ledger.exception.LedgerException;
import com.flagship.tenant_ledger.ledger.exception.PostingConflictException;
import com.flagship.tenant_ledger.ledger.exception.PostingRejectedException;
import com.flagship.tenant_ledger.ledger.exception.TenantAlreadyExistsException;
import com.flagship.tenant_ledger.ledger.exception.TenantNotFoundException;
import com.flagship.tenant_ledger.ledger.exception.TenantProvisioningException;
import com.flagship.tenant_ledger.ledger.exception.TenantSuspendedException;
import com.flagship.tenant_ledger.ledger.exception.UnknownAccountException;
import com.flagship.tenant_ledger.ledger.exception.VoucherNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger failures to HTTP responses.
 *
 * Rejections are 400, unknown tenant/account/voucher/asset 404, a suspended
 * tenant 403, conflicts 409. An unbalanced statement is an integrity alarm and
 * maps to 500; it has already been logged at ERROR where it was detected.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "MISSING_HEADER",
            "Required header '" + e.getHeaderName() + "' is missing");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error("VALIDATION_FAILED")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
    }

    @ExceptionHandler(PostingRejectedException.class)
    public ResponseEntity<ErrorResponse> handlePostingRejected(PostingRejectedException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler({
        TenantNotFoundException.class,
        UnknownAccountException.class,
        VoucherNotFoundException.class,
        AssetNotFoundException.class
    })
    public ResponseEntity<ErrorResponse> handleNotFound(LedgerException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(TenantSuspendedException.class)
    public ResponseEntity<ErrorResponse> handleSuspended(TenantSuspendedException e) {
        return respond(HttpStatus.FORBIDDEN, e);
    }

    @ExceptionHandler({
        PostingConflictException.class,
        AccountInUseException.class,
        DuplicateAccountException.class,
        DuplicateDocumentException.class,
        TenantAlreadyExistsException.class
    })
    public ResponseEntity<ErrorResponse> handleConflict(LedgerException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler({BooksUnbalancedException.class, TenantProvisioningException.class})
    public ResponseEntity<ErrorResponse> handleIntegrityFailure(LedgerException e) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, LedgerException e) {
        if (status.is4xxClientError()) {
            log.warn("Request failed with {}: {}", e.getErrorCode(), e.getMessage());
        }
        return respond(status, e.getErrorCode(), e.getMessage());
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message) {
        ErrorResponse error = ErrorResponse.builder()
            .error(code)
            .message(message)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(error);
    }

    /**
     * Error response body. {@code error} carries the stable error code.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
