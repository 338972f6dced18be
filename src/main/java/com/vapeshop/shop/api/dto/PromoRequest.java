package com.vapeshop.shop.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for creating a promo code.
 *
 * @author Vape Shop Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PromoRequest {

    @NotBlank(message = "Code is required")
    private String code;

    @NotNull(message = "Discount is required")
    @Min(value = 1, message = "Discount must be at least 1%")
    @Max(value = 100, message = "Discount must be at most 100%")
    private Integer discount;

    @NotNull(message = "Uses is required")
    @Min(value = 1, message = "Uses must be at least 1")
    private Integer uses;
}
