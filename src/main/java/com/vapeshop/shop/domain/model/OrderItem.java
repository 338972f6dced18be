package com.vapeshop.shop.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of an order. Stored inside the order record as part of a JSON array.
 *
 * @author Vape Shop Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OrderItem {

    private Long productId;

    /**
     * Product name at the time of purchase.
     */
    private String name;

    private Integer quantity;

    /**
     * Unit price at the time of purchase.
     */
    private Integer price;
}
