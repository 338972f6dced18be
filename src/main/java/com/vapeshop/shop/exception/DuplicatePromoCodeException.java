package com.vapeshop.shop.exception;

/**
 * Exception thrown when a promo code is created under a code that already exists.
 *
 * @author Vape Shop Team
 */
public class DuplicatePromoCodeException extends RuntimeException {

    private final String code;

    public DuplicatePromoCodeException(String code) {
        super(String.format("Promo code %s already exists", code));
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
