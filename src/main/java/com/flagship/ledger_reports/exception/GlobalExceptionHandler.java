package com.flagship.ledger_reports.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Maps report failures to HTTP responses with one consistent body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InconsistentDataException.class)
    public ResponseEntity<ErrorResponse> handleInconsistentData(InconsistentDataException e) {
        log.warn("Inconsistent data: issues={}, context={}", e.getIssues().size(), e.getContext());

        ErrorResponse error = ErrorResponse.builder()
            .error("Inconsistent Data")
            .kind(e.getKind())
            .message(e.getMessage())
            .details(e.getContext())
            .issues(e.getIssues())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(statusOf(e.getKind())).body(error);
    }

    @ExceptionHandler(ReportException.class)
    public ResponseEntity<ErrorResponse> handleReportException(ReportException e) {
        HttpStatus status = statusOf(e.getKind());
        if (status.is5xxServerError()) {
            log.error("Report failed: kind={}, context={}", e.getKind(), e.getContext(), e);
        } else {
            log.warn("Report rejected: kind={}, message={}", e.getKind(), e.getMessage());
        }

        ErrorResponse error = ErrorResponse.builder()
            .error(status.getReasonPhrase())
            .kind(e.getKind())
            .message(e.getMessage())
            .details(e.getContext())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());

        ErrorResponse error = ErrorResponse.builder()
            .error("Missing Required Parameter")
            .message("Required parameter '" + e.getParameterName() + "' is missing")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid parameter: name={}, value={}", e.getName(), e.getValue());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid Request")
            .message("Invalid value for parameter '" + e.getName() + "'")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid Request")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_RANGE -> HttpStatus.BAD_REQUEST;
            case INCONSISTENT_DATA -> HttpStatus.UNPROCESSABLE_ENTITY;
            case STORAGE -> HttpStatus.SERVICE_UNAVAILABLE;
            case CANCELLED -> HttpStatus.CONFLICT;
        };
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        ErrorKind kind;
        String message;
        Map<String, String> details;
        List<DataIssue> issues;
        Instant timestamp;
    }
}
