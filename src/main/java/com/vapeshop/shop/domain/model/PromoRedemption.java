package com.vapeshop.shop.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a successful promo code application.
 *
 * @author Vape Shop Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PromoRedemption {

    private String code;

    private Integer discount;

    /**
     * Redemption counter after this application.
     */
    private Integer used;
}
