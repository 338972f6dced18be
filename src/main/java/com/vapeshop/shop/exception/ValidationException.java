package com.vapeshop.shop.exception;

/**
 * Exception thrown when a required field is missing or malformed.
 * Never retried; the caller has to fix the request.
 *
 * @author Vape Shop Team
 */
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
