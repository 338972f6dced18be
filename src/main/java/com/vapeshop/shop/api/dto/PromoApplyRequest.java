package com.vapeshop.shop.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for applying a promo code. Without a userId the caller applies it.
 *
 * @author Vape Shop Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PromoApplyRequest {

    @NotBlank(message = "Code is required")
    private String code;

    private Long userId;
}
