package com.vapeshop.shop.api.dto;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Profile changes. Changing the bonus balance is reserved to admins.
 *
 * @author Vape Shop Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserUpdateRequest {

    private String username;

    @PositiveOrZero(message = "Bonus must not be negative")
    private Integer bonus;
}
