package com.vapeshop.shop.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Storefront user, keyed by the messaging-platform user id under {@code user:<id>}.
 *
 * @author Vape Shop Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    /**
     * External identity supplied by the caller. Never allocated.
     */
    private Long id;

    private String username;

    /**
     * Accumulated referral bonus, never negative.
     */
    @Builder.Default
    private Integer bonus = 0;

    /**
     * Ids of users who signed up with this user's referral code.
     */
    @Builder.Default
    private Set<Long> referrals = new LinkedHashSet<>();

    private String referralCode;

    /**
     * Derived from the admin allow-list on every read; not persisted.
     */
    private Boolean isAdmin;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;
}
