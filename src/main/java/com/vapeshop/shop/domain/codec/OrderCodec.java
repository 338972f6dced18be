package com.vapeshop.shop.domain.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vapeshop.shop.domain.model.Order;
import com.vapeshop.shop.domain.model.OrderItem;
import com.vapeshop.shop.exception.StoreException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Record codec for {@link Order}.
 * Items are kept in the record as a JSON array; id, userId and total are coerced to numbers.
 *
 * @author Vape Shop Team
 */
@Component
public class OrderCodec implements RecordCodec<Order> {

    static final String ID = "id";
    static final String USER_ID = "userId";
    static final String ITEMS = "items";
    static final String TOTAL = "total";
    public static final String STATUS = "status";
    static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";

    private static final TypeReference<List<OrderItem>> ITEM_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public OrderCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<String, String> encode(Order order) {
        Map<String, String> fields = new LinkedHashMap<>();
        FieldValues.put(fields, ID, order.getId());
        FieldValues.put(fields, USER_ID, order.getUserId());
        if (order.getItems() != null) {
            fields.put(ITEMS, writeItems(order.getItems()));
        }
        FieldValues.put(fields, TOTAL, order.getTotal());
        FieldValues.put(fields, STATUS, order.getStatus());
        FieldValues.put(fields, CREATED_AT, order.getCreatedAt());
        FieldValues.put(fields, UPDATED_AT, order.getUpdatedAt());
        return fields;
    }

    @Override
    public Order decode(Map<String, String> fields) {
        return Order.builder()
                .id(FieldValues.readLong(fields, ID))
                .userId(FieldValues.readLong(fields, USER_ID))
                .items(readItems(fields.get(ITEMS)))
                .total(FieldValues.readInt(fields, TOTAL))
                .status(FieldValues.readString(fields, STATUS))
                .createdAt(FieldValues.readInstant(fields, CREATED_AT))
                .updatedAt(FieldValues.readInstant(fields, UPDATED_AT))
                .build();
    }

    private String writeItems(List<OrderItem> items) {
        try {
            return objectMapper.writeValueAsString(items);
        } catch (JsonProcessingException e) {
            throw new StoreException(ITEMS, "Cannot serialize order items", e);
        }
    }

    private List<OrderItem> readItems(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            List<OrderItem> items = objectMapper.readValue(json, ITEM_LIST);
            return items == null ? new ArrayList<>() : items;
        } catch (JsonProcessingException e) {
            throw new StoreException(ITEMS, "Malformed order items: " + json, e);
        }
    }
}
