package com.vapeshop.shop.repository;

import com.vapeshop.shop.domain.codec.StatsCodec;
import com.vapeshop.shop.domain.model.Stats;
import com.vapeshop.shop.infrastructure.kv.KeyValueStore;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;

/**
 * The singleton {@code stats} record.
 *
 * @author Vape Shop Team
 */
@Repository
public class StatsRepository {

    public static final String KEY = "stats";

    private final KeyValueStore store;
    private final StatsCodec codec;

    public StatsRepository(KeyValueStore store, StatsCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    public Optional<Stats> find() {
        Map<String, String> fields = store.getFields(KEY);
        return fields.isEmpty() ? Optional.empty() : Optional.of(codec.decode(fields));
    }

    public void save(Stats stats) {
        store.setFields(KEY, codec.encode(stats));
    }
}
