package com.vapeshop.shop.domain.codec;

import com.vapeshop.shop.domain.model.Product;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Record codec for {@link Product}. Coerces id, price and stock to numbers on read.
 *
 * @author Vape Shop Team
 */
@Component
public class ProductCodec implements RecordCodec<Product> {

    static final String ID = "id";
    static final String NAME = "name";
    static final String CATEGORY = "category";
    static final String PRICE = "price";
    static final String STOCK = "stock";
    static final String DESCRIPTION = "description";
    static final String EMOJI = "emoji";
    public static final String CREATED_AT = "created_at";
    static final String UPDATED_AT = "updated_at";

    @Override
    public Map<String, String> encode(Product product) {
        Map<String, String> fields = new LinkedHashMap<>();
        FieldValues.put(fields, ID, product.getId());
        FieldValues.put(fields, NAME, product.getName());
        FieldValues.put(fields, CATEGORY, product.getCategory());
        FieldValues.put(fields, PRICE, product.getPrice());
        FieldValues.put(fields, STOCK, product.getStock());
        FieldValues.put(fields, DESCRIPTION, product.getDescription());
        FieldValues.put(fields, EMOJI, product.getEmoji());
        FieldValues.put(fields, CREATED_AT, product.getCreatedAt());
        FieldValues.put(fields, UPDATED_AT, product.getUpdatedAt());
        return fields;
    }

    @Override
    public Product decode(Map<String, String> fields) {
        return Product.builder()
                .id(FieldValues.readLong(fields, ID))
                .name(FieldValues.readString(fields, NAME))
                .category(FieldValues.readString(fields, CATEGORY))
                .price(FieldValues.readInt(fields, PRICE))
                .stock(FieldValues.readInt(fields, STOCK))
                .description(FieldValues.readString(fields, DESCRIPTION))
                .emoji(FieldValues.readString(fields, EMOJI))
                .createdAt(FieldValues.readInstant(fields, CREATED_AT))
                .updatedAt(FieldValues.readInstant(fields, UPDATED_AT))
                .build();
    }
}
