package com.vapeshop.shop.exception;

/**
 * Exception thrown when the key-value store is unreachable, a command fails,
 * or a stored value cannot be decoded.
 * Surfaced to callers as an internal failure; nothing retries it.
 *
 * @author Vape Shop Team
 */
public class StoreException extends RuntimeException {

    private final String key;

    public StoreException(String key, String message) {
        super(message);
        this.key = key;
    }

    public StoreException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
