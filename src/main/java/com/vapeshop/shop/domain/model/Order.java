package com.vapeshop.shop.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Order placed at checkout, stored under {@code order:<id>}.
 * Orders are never deleted; only their status changes.
 *
 * @author Vape Shop Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_CANCELLED = "cancelled";

    private Long id;

    /**
     * Owner of the order. Not checked against existing users.
     */
    private Long userId;

    @Builder.Default
    private List<OrderItem> items = new ArrayList<>();

    private Integer total;

    /**
     * Open set of values; {@link #STATUS_COMPLETED} is the only one that counts towards revenue.
     */
    private String status;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    /**
     * @return true if the order counts towards revenue
     */
    @JsonIgnore
    public boolean isCompleted() {
        return STATUS_COMPLETED.equals(status);
    }
}
