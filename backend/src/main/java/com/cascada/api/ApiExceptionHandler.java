/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.api;

import com.cascada.application.execution.RequestCancelledException;
import com.cascada.application.routing.NoProviderAvailableException;
import com.cascada.config.RequestIdFilter;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex) {
        return respond(ex.getStatus(), ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(NoProviderAvailableException.class)
    public ResponseEntity<ApiErrorResponse> handleNoProvider(NoProviderAvailableException ex) {
        log.warn("No provider available requestId={} message={}", currentRequestId(), ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "NO_PROVIDER_AVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(RequestCancelledException.class)
    public ResponseEntity<ApiErrorResponse> handleCancelled(RequestCancelledException ex) {
        log.info("Request cancelled requestId={} provider={}", currentRequestId(), ex.getProviderId());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "REQUEST_CANCELLED", "Request was cancelled");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class})
    public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Invalid request");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return respond(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body could not be read");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(NoResourceFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not found");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleAny(Exception ex) {
        log.error("Unhandled exception requestId={}", currentRequestId(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", "Unexpected error");
    }

    private ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String code, String message) {
        ApiErrorResponse body = new ApiErrorResponse(
                status.name(),
                code,
                message,
                currentRequestId()
        );
        return ResponseEntity.status(status).body(body);
    }

    private String currentRequestId() {
        String rid = MDC.get(RequestIdFilter.MDC_KEY);
        return (rid == null || rid.isBlank()) ? "" : rid;
    }
}
