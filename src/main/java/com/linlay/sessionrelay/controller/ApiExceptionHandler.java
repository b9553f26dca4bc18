package com.linlay.sessionrelay.controller;

import com.linlay.sessionrelay.model.api.ApiResponse;
import com.linlay.sessionrelay.workspace.ProjectNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps relay failures onto the {@link ApiResponse} envelope. Bad session ids and unusable directories surface as
 * {@link IllegalArgumentException}; unknown projects as {@link ProjectNotFoundException}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleBadRequest(IllegalArgumentException ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return ApiResponse.reply(HttpStatus.BAD_REQUEST, ex.getMessage(), Map.of());
    }

    @ExceptionHandler(ProjectNotFoundException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleUnknownProject(ProjectNotFoundException ex) {
        log.debug("Unknown project: {}", ex.getMessage());
        return ApiResponse.reply(HttpStatus.NOT_FOUND, ex.getMessage(), Map.of());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleInvalidBody(WebExchangeBindException ex) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        return ApiResponse.reply(HttpStatus.BAD_REQUEST, "Invalid request body", Map.of("fields", fields));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleStatus(ResponseStatusException ex) {
        return ApiResponse.reply(ex.getStatusCode(), ex.getReason(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleUnexpected(Exception ex) {
        log.error("Relay request failed", ex);
        return ApiResponse.reply(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", Map.of());
    }
}
