package com.vapeshop.shop.domain.codec;

import java.util.Map;

/**
 * Pure mapping between an entity and its flat string record in the key-value store.
 *
 * The store has no schema, so all type coercion (numbers, timestamps, nested
 * structures) happens here and nowhere else.
 *
 * @param <T> Entity type
 * @author Vape Shop Team
 */
public interface RecordCodec<T> {

    /**
     * Encode the non-null fields of an entity.
     * Null fields are left out so that writing the result never clears stored values.
     *
     * @param entity Entity to encode
     * @return Field values ready for the store
     */
    Map<String, String> encode(T entity);

    /**
     * Decode a stored record.
     *
     * @param fields Non-empty record read from the store
     * @return Decoded entity
     * @throws com.vapeshop.shop.exception.StoreException if a stored value is malformed
     */
    T decode(Map<String, String> fields);
}
