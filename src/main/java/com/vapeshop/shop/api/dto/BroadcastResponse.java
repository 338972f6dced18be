package com.vapeshop.shop.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastResponse {

    private boolean success;

    /**
     * Number of users the message was addressed to.
     */
    private int recipients;
}
