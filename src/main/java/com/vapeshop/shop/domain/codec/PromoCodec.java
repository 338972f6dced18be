package com.vapeshop.shop.domain.codec;

import com.vapeshop.shop.domain.model.Promo;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Record codec for {@link Promo}.
 *
 * @author Vape Shop Team
 */
@Component
public class PromoCodec implements RecordCodec<Promo> {

    static final String CODE = "code";
    static final String DISCOUNT = "discount";
    static final String USES = "uses";
    public static final String USED = "used";
    static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";

    @Override
    public Map<String, String> encode(Promo promo) {
        Map<String, String> fields = new LinkedHashMap<>();
        FieldValues.put(fields, CODE, promo.getCode());
        FieldValues.put(fields, DISCOUNT, promo.getDiscount());
        FieldValues.put(fields, USES, promo.getUses());
        FieldValues.put(fields, USED, promo.getUsed());
        FieldValues.put(fields, CREATED_AT, promo.getCreatedAt());
        FieldValues.put(fields, UPDATED_AT, promo.getUpdatedAt());
        return fields;
    }

    @Override
    public Promo decode(Map<String, String> fields) {
        return Promo.builder()
                .code(FieldValues.readString(fields, CODE))
                .discount(FieldValues.readInt(fields, DISCOUNT, 0))
                .uses(FieldValues.readInt(fields, USES, 0))
                .used(FieldValues.readInt(fields, USED, 0))
                .createdAt(FieldValues.readInstant(fields, CREATED_AT))
                .updatedAt(FieldValues.readInstant(fields, UPDATED_AT))
                .build();
    }
}
