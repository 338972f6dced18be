package com.vapeshop.shop.api.dto;

import com.vapeshop.shop.domain.model.Order;
import com.vapeshop.shop.domain.model.OrderItem;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body for checkout.
 *
 * @author Vape Shop Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderRequest {

    @NotNull(message = "User ID is required")
    private Long userId;

    @NotEmpty(message = "Order must contain at least one item")
    private List<OrderItem> items;

    @NotNull(message = "Total is required")
    @PositiveOrZero(message = "Total must not be negative")
    private Integer total;

    private String status;

    public Order toOrder() {
        return Order.builder()
                .userId(userId)
                .items(items == null ? new ArrayList<>() : new ArrayList<>(items))
                .total(total)
                .status(status)
                .build();
    }
}
