package com.vapeshop.shop.infrastructure.kv;

import java.util.Map;
import java.util.Set;

/**
 * Primitives the repositories need from the key-value store.
 *
 * Records are flat string-to-string mappings stored under namespaced keys
 * ({@code product:7}, {@code promo:SUMMER}); counters are plain integer keys
 * ({@code product:counter}). Each call is a single store round-trip, and only
 * {@link #increment(String)} and {@link #incrementField(String, String, long)}
 * are atomic read-modify-write operations.
 *
 * All methods throw {@link com.vapeshop.shop.exception.StoreException} when the
 * store cannot serve the request.
 *
 * @author Vape Shop Team
 */
public interface KeyValueStore {

    /**
     * Atomically increment an integer key by one, creating it at 0 first if absent.
     *
     * @param key Counter key
     * @return Value after the increment
     */
    long increment(String key);

    /**
     * Atomically increment an integer field of a record.
     *
     * @param key Record key
     * @param field Field name
     * @param delta Amount to add
     * @return Field value after the increment
     */
    long incrementField(String key, String field, long delta);

    /**
     * Write the given fields into a record. Fields not in the mapping keep their stored values.
     *
     * @param key Record key
     * @param fields Field values to write
     */
    void setFields(String key, Map<String, String> fields);

    /**
     * Read all fields of a record.
     *
     * @param key Record key
     * @return Field values, empty if the record does not exist
     */
    Map<String, String> getFields(String key);

    /**
     * Remove a key.
     *
     * @param key Key to remove
     * @return true if the key existed
     */
    boolean deleteKey(String key);

    /**
     * Enumerate keys starting with a prefix.
     *
     * @param prefix Key prefix, e.g. {@code "order:"}
     * @return Matching keys, in no particular order
     */
    Set<String> keysWithPrefix(String prefix);

    /**
     * @param key Key to check
     * @return true if the key exists
     */
    boolean existsKey(String key);
}
