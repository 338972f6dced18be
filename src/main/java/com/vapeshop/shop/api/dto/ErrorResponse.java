package com.vapeshop.shop.api.dto;

import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body returned by every failed API call.
 *
 * @author Vape Shop Team
 */
@Getter
public class ErrorResponse {

    private final Instant timestamp;
    private final int status;
    private final String error;
    private final String message;
    private final String path;
    private final Map<String, Object> details = new LinkedHashMap<>();

    public ErrorResponse(int status, String error, String message, String path) {
        this.timestamp = Instant.now();
        this.status = status;
        this.error = error;
        this.message = message;
        this.path = path;
    }

    /**
     * Add additional error details.
     *
     * @param key Detail key
     * @param value Detail value
     * @return This ErrorResponse for method chaining
     */
    public ErrorResponse addDetail(String key, Object value) {
        details.put(key, value);
        return this;
    }
}
