package com.vapeshop.shop.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Promo code stored under {@code promo:<code>}.
 *
 * @author Vape Shop Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Promo {

    private String code;

    /**
     * Discount percentage (e.g. 15 for 15% off).
     */
    private Integer discount;

    /**
     * Maximum number of redemptions.
     */
    private Integer uses;

    /**
     * Redemptions so far. Only ever incremented.
     */
    @Builder.Default
    private Integer used = 0;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    /**
     * @return true if at least one redemption is left
     */
    @JsonIgnore
    public boolean hasRemainingUses() {
        return used < uses;
    }
}
