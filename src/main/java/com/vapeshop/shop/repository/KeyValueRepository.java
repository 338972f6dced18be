package com.vapeshop.shop.repository;

import com.vapeshop.shop.domain.codec.RecordCodec;
import com.vapeshop.shop.infrastructure.kv.KeyValueStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Base for repositories that keep one entity type under a {@code <entity>:} key namespace.
 *
 * @param <T> Entity type
 * @author Vape Shop Team
 */
abstract class KeyValueRepository<T> {

    protected final KeyValueStore store;
    protected final RecordCodec<T> codec;
    private final String entityType;

    protected KeyValueRepository(KeyValueStore store, RecordCodec<T> codec, String entityType) {
        this.store = store;
        this.codec = codec;
        this.entityType = entityType;
    }

    protected String keyFor(Object id) {
        return entityType + ":" + id;
    }

    protected Optional<T> load(String key) {
        Map<String, String> fields = store.getFields(key);
        if (fields.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(codec.decode(fields));
    }

    /**
     * Load every record in the namespace, skipping the allocator counter.
     * Records deleted between the key scan and the read are skipped as well.
     */
    protected List<T> loadAll() {
        String counterKey = IdAllocator.counterKey(entityType);
        List<T> entities = new ArrayList<>();
        for (String key : store.keysWithPrefix(entityType + ":")) {
            if (key.equals(counterKey)) {
                continue;
            }
            load(key).ifPresent(entities::add);
        }
        return entities;
    }
}
