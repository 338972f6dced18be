package com.vapeshop.shop.infrastructure.kv;

import com.vapeshop.shop.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Redis implementation of {@link KeyValueStore}.
 *
 * Mapping:
 * - increment -> INCR
 * - incrementField -> HINCRBY
 * - setFields -> HSET (multi-field)
 * - getFields -> HGETALL
 * - deleteKey -> DEL
 * - keysWithPrefix -> KEYS prefix*
 * - existsKey -> EXISTS
 *
 * Failures are logged and rethrown as {@link StoreException}; reconnects are left
 * to the Lettuce client.
 *
 * @author Vape Shop Team
 */
@Component
public class RedisKeyValueStore implements KeyValueStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisKeyValueStore.class);

    private final StringRedisTemplate redisTemplate;

    public RedisKeyValueStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public long increment(String key) {
        try {
            Long value = redisTemplate.opsForValue().increment(key);
            if (value == null) {
                throw new StoreException(key, "INCR returned no value for " + key);
            }
            logger.debug("Incremented {} to {}", key, value);
            return value;
        } catch (DataAccessException e) {
            logger.error("Error incrementing counter: {}", key, e);
            throw new StoreException(key, "Failed to increment " + key, e);
        }
    }

    @Override
    public long incrementField(String key, String field, long delta) {
        try {
            Long value = hashOps().increment(key, field, delta);
            if (value == null) {
                throw new StoreException(key, "HINCRBY returned no value for " + key + "." + field);
            }
            logger.debug("Incremented {}.{} by {} to {}", key, field, delta, value);
            return value;
        } catch (DataAccessException e) {
            logger.error("Error incrementing field {} of {}", field, key, e);
            throw new StoreException(key, "Failed to increment " + key + "." + field, e);
        }
    }

    @Override
    public void setFields(String key, Map<String, String> fields) {
        if (fields.isEmpty()) {
            return;
        }
        try {
            hashOps().putAll(key, fields);
            logger.debug("Wrote {} fields to {}", fields.size(), key);
        } catch (DataAccessException e) {
            logger.error("Error writing record: {}", key, e);
            throw new StoreException(key, "Failed to write " + key, e);
        }
    }

    @Override
    public Map<String, String> getFields(String key) {
        try {
            Map<String, String> entries = hashOps().entries(key);
            if (entries == null || entries.isEmpty()) {
                return Collections.emptyMap();
            }
            return new LinkedHashMap<>(entries);
        } catch (DataAccessException e) {
            logger.error("Error reading record: {}", key, e);
            throw new StoreException(key, "Failed to read " + key, e);
        }
    }

    @Override
    public boolean deleteKey(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.delete(key));
        } catch (DataAccessException e) {
            logger.error("Error deleting key: {}", key, e);
            throw new StoreException(key, "Failed to delete " + key, e);
        }
    }

    @Override
    public Set<String> keysWithPrefix(String prefix) {
        try {
            Set<String> keys = redisTemplate.keys(prefix + "*");
            return keys == null ? Collections.emptySet() : new HashSet<>(keys);
        } catch (DataAccessException e) {
            logger.error("Error listing keys with prefix: {}", prefix, e);
            throw new StoreException(prefix, "Failed to list keys under " + prefix, e);
        }
    }

    @Override
    public boolean existsKey(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(key));
        } catch (DataAccessException e) {
            logger.error("Error checking key: {}", key, e);
            throw new StoreException(key, "Failed to check " + key, e);
        }
    }

    private HashOperations<String, String, String> hashOps() {
        return redisTemplate.opsForHash();
    }
}
