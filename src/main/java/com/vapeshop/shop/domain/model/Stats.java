package com.vapeshop.shop.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Aggregate shop statistics, stored as the singleton {@code stats} record.
 * Always recomputed from the full entity set, never updated incrementally.
 *
 * @author Vape Shop Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Stats {

    @JsonProperty("total_orders")
    private long totalOrders;

    @JsonProperty("total_products")
    private long totalProducts;

    @JsonProperty("total_users")
    private long totalUsers;

    /**
     * Sum of totals of completed orders.
     */
    @JsonProperty("total_revenue")
    private long totalRevenue;

    @JsonProperty("updated_at")
    private Instant updatedAt;
}
