package com.cred.freestyle.stockcount.api.dto;

import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body returned by every failing stock count endpoint.
 *
 * @author Stock Count Team
 */
public class ErrorResponse {

    private final Instant timestamp;
    private final Integer status;
    private final String error;
    private final String message;
    private final String path;
    private final Map<String, Object> details = new LinkedHashMap<>();

    private ErrorResponse(Integer status, String error, String message, String path) {
        this.timestamp = Instant.now();
        this.status = status;
        this.error = error;
        this.message = message;
        this.path = path;
    }

    /**
     * Create an error body.
     *
     * @param status HTTP status
     * @param error Short title (e.g., "Not Acceptable")
     * @param message Human readable message
     * @param path Request URI
     * @return ErrorResponse
     */
    public static ErrorResponse of(HttpStatus status, String error, String message, String path) {
        return new ErrorResponse(status.value(), error, message, path);
    }

    public ErrorResponse addDetail(String key, Object value) {
        this.details.put(key, value);
        return this;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Integer getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public String getPath() {
        return path;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
