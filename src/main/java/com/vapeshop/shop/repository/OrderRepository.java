package com.vapeshop.shop.repository;

import com.vapeshop.shop.domain.codec.OrderCodec;
import com.vapeshop.shop.domain.event.OrderChangedEvent;
import com.vapeshop.shop.domain.event.OrderChangedEvent.ChangeType;
import com.vapeshop.shop.domain.model.Order;
import com.vapeshop.shop.infrastructure.kv.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Orders stored as {@code order:<id>} records.
 *
 * Every save and status change publishes an {@link OrderChangedEvent}; the stats
 * aggregator listens for it and rescans all entities in the same thread.
 *
 * @author Vape Shop Team
 */
@Repository
public class OrderRepository extends KeyValueRepository<Order> {

    private static final Logger logger = LoggerFactory.getLogger(OrderRepository.class);

    public static final String ENTITY = "order";

    private final IdAllocator idAllocator;
    private final ApplicationEventPublisher eventPublisher;

    public OrderRepository(
            KeyValueStore store,
            OrderCodec codec,
            IdAllocator idAllocator,
            ApplicationEventPublisher eventPublisher
    ) {
        super(store, codec, ENTITY);
        this.idAllocator = idAllocator;
        this.eventPublisher = eventPublisher;
    }

    /**
     * List all orders.
     *
     * @return Orders sorted by id descending (most recent first)
     */
    public List<Order> list() {
        List<Order> orders = loadAll();
        orders.sort(Comparator.comparing(Order::getId, Comparator.nullsLast(Comparator.reverseOrder())));
        logger.debug("Loaded {} orders", orders.size());
        return orders;
    }

    public Optional<Order> findById(long id) {
        return load(keyFor(id));
    }

    /**
     * Orders of one user, most recent first.
     * Filters the full list: there is no per-user index, so cost grows with the total order count.
     *
     * @param userId Owner id
     * @return Matching orders
     */
    public List<Order> listByUser(long userId) {
        return list().stream()
                .filter(order -> order.getUserId() != null && order.getUserId() == userId)
                .collect(Collectors.toList());
    }

    /**
     * Create or overwrite an order.
     * Defaults status to "pending" and created_at to now when absent.
     *
     * @param order Order data; mutated with id, status and timestamps
     * @return The same order, items still structured
     */
    public Order save(Order order) {
        Instant now = Instant.now();
        if (order.getId() == null) {
            order.setId(idAllocator.next(ENTITY));
        }
        if (order.getStatus() == null || order.getStatus().isBlank()) {
            order.setStatus(Order.STATUS_PENDING);
        }
        if (order.getCreatedAt() == null) {
            order.setCreatedAt(now);
        }
        order.setUpdatedAt(now);

        store.setFields(keyFor(order.getId()), codec.encode(order));
        logger.info("Saved order {} for user {} (total: {}, status: {})",
                order.getId(), order.getUserId(), order.getTotal(), order.getStatus());

        eventPublisher.publishEvent(new OrderChangedEvent(order.getId(), ChangeType.SAVED));
        return order;
    }

    /**
     * Change the status of an existing order in place.
     *
     * @param id Order id
     * @param status New status
     * @return false if no such order
     */
    public boolean updateStatus(long id, String status) {
        String key = keyFor(id);
        if (!store.existsKey(key)) {
            logger.debug("Order {} not found for status update", id);
            return false;
        }

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(OrderCodec.STATUS, status);
        fields.put(OrderCodec.UPDATED_AT, Instant.now().toString());
        store.setFields(key, fields);
        logger.info("Order {} status changed to {}", id, status);

        eventPublisher.publishEvent(new OrderChangedEvent(id, ChangeType.STATUS_CHANGED));
        return true;
    }
}
