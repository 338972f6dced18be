package com.vapeshop.shop.exception;

/**
 * Exception thrown when a promo code has no redemptions left.
 *
 * @author Vape Shop Team
 */
public class PromoLimitReachedException extends RuntimeException {

    private final String code;
    private final int uses;
    private final int used;

    public PromoLimitReachedException(String code, int uses, int used) {
        super(String.format("Promo code %s has reached its limit. Uses: %d, Used: %d", code, uses, used));
        this.code = code;
        this.uses = uses;
        this.used = used;
    }

    public String getCode() {
        return code;
    }

    public int getUses() {
        return uses;
    }

    public int getUsed() {
        return used;
    }
}
