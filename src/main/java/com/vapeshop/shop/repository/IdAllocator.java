package com.vapeshop.shop.repository;

import com.vapeshop.shop.infrastructure.kv.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Issues per-entity-type integer ids from an atomic counter key ({@code <entity>:counter}).
 *
 * Ids start at 1 and are never handed out twice. If the save that follows an
 * allocation fails, that id is simply skipped.
 *
 * @author Vape Shop Team
 */
@Component
public class IdAllocator {

    private static final Logger logger = LoggerFactory.getLogger(IdAllocator.class);

    public static final String COUNTER_SUFFIX = "counter";

    private final KeyValueStore store;

    public IdAllocator(KeyValueStore store) {
        this.store = store;
    }

    /**
     * Allocate the next id for an entity type.
     *
     * @param entityType Entity namespace, e.g. "product"
     * @return Next id, strictly greater than every id issued before for this type
     */
    public long next(String entityType) {
        long id = store.increment(counterKey(entityType));
        logger.debug("Allocated {} id {}", entityType, id);
        return id;
    }

    public static String counterKey(String entityType) {
        return entityType + ":" + COUNTER_SUFFIX;
    }
}
