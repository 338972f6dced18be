package com.vapeshop.shop.api.dto;

import com.vapeshop.shop.domain.model.Product;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for creating or updating a product.
 * Constraints apply on create; an update only changes the fields it carries.
 *
 * @author Vape Shop Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductRequest {

    @NotBlank(message = "Name is required")
    private String name;

    @NotBlank(message = "Category is required")
    private String category;

    @NotNull(message = "Price is required")
    @PositiveOrZero(message = "Price must not be negative")
    private Integer price;

    @NotNull(message = "Stock is required")
    @PositiveOrZero(message = "Stock must not be negative")
    private Integer stock;

    private String description;

    private String emoji;

    public Product toProduct() {
        return Product.builder()
                .name(name)
                .category(category)
                .price(price)
                .stock(stock)
                .description(description)
                .emoji(emoji)
                .build();
    }
}
