package com.vapeshop.shop.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReferralRequest {

    @NotBlank(message = "Referral code is required")
    private String referralCode;
}
