package com.example.cardamageanalyzer.controller;

import com.example.cardamageanalyzer.exception.BatchFailure;
import com.example.cardamageanalyzer.exception.BatchProcessingException;
import com.example.cardamageanalyzer.exception.ScoringException;
import com.example.cardamageanalyzer.model.BatchStatusResponse;
import com.example.cardamageanalyzer.model.ErrorResponse;
import com.example.cardamageanalyzer.model.ItemError;
import com.example.cardamageanalyzer.model.ItemErrorKind;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;

@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(BatchProcessingException.class)
    public ResponseEntity<ErrorResponse> handleBatchFailure(BatchProcessingException exception, HttpServletRequest request) {
        HttpStatus status = statusFor(exception.getFailure());
        BatchStatusResponse batch = exception.getSnapshot() == null
                ? null
                : BatchStatusResponse.from(exception.getSnapshot());
        ErrorResponse body = new ErrorResponse(Instant.now(), status.value(), status.getReasonPhrase(),
                exception.getMessage(), request.getRequestURI(), exception.getFailure(), batch);
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(ScoringException.class)
    public ResponseEntity<ErrorResponse> handleScoringFailure(ScoringException exception, HttpServletRequest request) {
        HttpStatus status = statusFor(exception.getError());
        log.warn("Scoring failed for {}: {}", request.getRequestURI(), exception.getMessage());
        return build(status, exception.getMessage(), request);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException exception, HttpServletRequest request) {
        HttpStatus status = HttpStatus.valueOf(exception.getStatusCode().value());
        return build(status, exception.getReason(), request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException exception, HttpServletRequest request) {
        return build(HttpStatus.PAYLOAD_TOO_LARGE, "Uploaded files exceed the configured size limit", request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException exception, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, exception.getMessage(), request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException exception, HttpServletRequest request) {
        log.error("Request {} failed", request.getRequestURI(), exception);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, exception.getMessage(), request);
    }

    static HttpStatus statusFor(BatchFailure failure) {
        return switch (failure) {
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case EMPTY_BATCH, BUSY, CANCELLED -> HttpStatus.CONFLICT;
            case ALL_ITEMS_FAILED -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }

    // Upstream error statuses are relayed; anything else is a bad gateway.
    static HttpStatus statusFor(ItemError error) {
        if (error.kind() == ItemErrorKind.SERVICE_ERROR && error.status() != null) {
            HttpStatus upstream = HttpStatus.resolve(error.status());
            if (upstream != null && upstream.isError()) {
                return upstream;
            }
        }
        return HttpStatus.BAD_GATEWAY;
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(Instant.now(), status.value(), status.getReasonPhrase(), message,
                request.getRequestURI(), null, null);
        return ResponseEntity.status(status).body(body);
    }
}
