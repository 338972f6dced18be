package com.vapeshop.shop.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Catalog product stored under {@code product:<id>}.
 *
 * @author Vape Shop Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    /**
     * Assigned by the id allocator on first save, never reused.
     */
    private Long id;

    private String name;

    /**
     * Catalog section, e.g. "liquids", "pods", "devices".
     */
    private String category;

    /**
     * Price in whole currency units.
     */
    private Integer price;

    private Integer stock;

    private String description;

    /**
     * Emoji shown next to the product in the storefront.
     */
    private String emoji;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;
}
