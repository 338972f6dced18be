package com.vapeshop.shop.domain.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vapeshop.shop.domain.model.User;
import com.vapeshop.shop.exception.StoreException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Record codec for {@link User}.
 * Referrals are kept as a JSON array. The admin flag is never written or read here.
 *
 * @author Vape Shop Team
 */
@Component
public class UserCodec implements RecordCodec<User> {

    static final String ID = "id";
    static final String USERNAME = "username";
    static final String BONUS = "bonus";
    static final String REFERRALS = "referrals";
    static final String REFERRAL_CODE = "referralCode";
    static final String CREATED_AT = "created_at";
    static final String UPDATED_AT = "updated_at";

    private static final TypeReference<LinkedHashSet<Long>> ID_SET = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public UserCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<String, String> encode(User user) {
        Map<String, String> fields = new LinkedHashMap<>();
        FieldValues.put(fields, ID, user.getId());
        FieldValues.put(fields, USERNAME, user.getUsername());
        FieldValues.put(fields, BONUS, user.getBonus());
        if (user.getReferrals() != null) {
            fields.put(REFERRALS, writeReferrals(user.getReferrals()));
        }
        FieldValues.put(fields, REFERRAL_CODE, user.getReferralCode());
        FieldValues.put(fields, CREATED_AT, user.getCreatedAt());
        FieldValues.put(fields, UPDATED_AT, user.getUpdatedAt());
        return fields;
    }

    @Override
    public User decode(Map<String, String> fields) {
        return User.builder()
                .id(FieldValues.readLong(fields, ID))
                .username(FieldValues.readString(fields, USERNAME))
                .bonus(FieldValues.readInt(fields, BONUS, 0))
                .referrals(readReferrals(fields.get(REFERRALS)))
                .referralCode(FieldValues.readString(fields, REFERRAL_CODE))
                .createdAt(FieldValues.readInstant(fields, CREATED_AT))
                .updatedAt(FieldValues.readInstant(fields, UPDATED_AT))
                .build();
    }

    private String writeReferrals(Set<Long> referrals) {
        try {
            return objectMapper.writeValueAsString(referrals);
        } catch (JsonProcessingException e) {
            throw new StoreException(REFERRALS, "Cannot serialize referrals", e);
        }
    }

    private Set<Long> readReferrals(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashSet<>();
        }
        try {
            Set<Long> referrals = objectMapper.readValue(json, ID_SET);
            return referrals == null ? new LinkedHashSet<>() : referrals;
        } catch (JsonProcessingException e) {
            throw new StoreException(REFERRALS, "Malformed referrals: " + json, e);
        }
    }
}
