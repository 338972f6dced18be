package com.vapeshop.shop.domain.codec;

import com.vapeshop.shop.domain.model.Stats;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Record codec for the {@link Stats} singleton.
 *
 * @author Vape Shop Team
 */
@Component
public class StatsCodec implements RecordCodec<Stats> {

    static final String TOTAL_ORDERS = "total_orders";
    static final String TOTAL_PRODUCTS = "total_products";
    static final String TOTAL_USERS = "total_users";
    static final String TOTAL_REVENUE = "total_revenue";
    static final String UPDATED_AT = "updated_at";

    @Override
    public Map<String, String> encode(Stats stats) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(TOTAL_ORDERS, Long.toString(stats.getTotalOrders()));
        fields.put(TOTAL_PRODUCTS, Long.toString(stats.getTotalProducts()));
        fields.put(TOTAL_USERS, Long.toString(stats.getTotalUsers()));
        fields.put(TOTAL_REVENUE, Long.toString(stats.getTotalRevenue()));
        FieldValues.put(fields, UPDATED_AT, stats.getUpdatedAt());
        return fields;
    }

    @Override
    public Stats decode(Map<String, String> fields) {
        return Stats.builder()
                .totalOrders(FieldValues.readLong(fields, TOTAL_ORDERS, 0L))
                .totalProducts(FieldValues.readLong(fields, TOTAL_PRODUCTS, 0L))
                .totalUsers(FieldValues.readLong(fields, TOTAL_USERS, 0L))
                .totalRevenue(FieldValues.readLong(fields, TOTAL_REVENUE, 0L))
                .updatedAt(FieldValues.readInstant(fields, UPDATED_AT))
                .build();
    }
}
