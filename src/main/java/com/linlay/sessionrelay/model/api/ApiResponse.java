package com.linlay.sessionrelay.model.api;

import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Envelope shared by every JSON endpoint. {@code code} is {@value #SUCCESS_CODE} on success and the HTTP status
 * of the reply otherwise.
 */
public record ApiResponse<T>(
        int code,
        String msg,
        T data
) {

    public static final int SUCCESS_CODE = 0;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(SUCCESS_CODE, "success", data);
    }

    public static ApiResponse<Map<String, Object>> failure(HttpStatusCode status, String msg) {
        return failure(status, msg, Map.of());
    }

    /**
     * Falls back to the status reason phrase when {@code msg} is blank.
     */
    public static <T> ApiResponse<T> failure(HttpStatusCode status, String msg, T data) {
        return new ApiResponse<>(status.value(), StringUtils.hasText(msg) ? msg : reasonPhrase(status), data);
    }

    /**
     * Wraps a failure envelope in a response carrying the same status.
     */
    public static <T> ResponseEntity<ApiResponse<T>> reply(HttpStatusCode status, String msg, T data) {
        return ResponseEntity.status(status).body(failure(status, msg, data));
    }

    private static String reasonPhrase(HttpStatusCode status) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        return resolved != null ? resolved.getReasonPhrase() : "Request failed";
    }
}
