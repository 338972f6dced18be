package com.vapeshop.shop.service;

import com.vapeshop.shop.domain.event.OrderChangedEvent;
import com.vapeshop.shop.domain.model.Order;
import com.vapeshop.shop.domain.model.Stats;
import com.vapeshop.shop.repository.OrderRepository;
import com.vapeshop.shop.repository.ProductRepository;
import com.vapeshop.shop.repository.StatsRepository;
import com.vapeshop.shop.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Maintains the singleton {@link Stats} record.
 *
 * Stats are a materialized view rebuilt from scratch: every order save or status
 * change triggers a full rescan of products, orders and users in the request thread.
 * Cost is linear in the total entity count.
 *
 * @author Vape Shop Team
 */
@Service
public class StatsAggregator {

    private static final Logger logger = LoggerFactory.getLogger(StatsAggregator.class);

    private final ProductRepository productRepository;
    private final OrderRepository orderRepository;
    private final UserRepository userRepository;
    private final StatsRepository statsRepository;

    public StatsAggregator(
            ProductRepository productRepository,
            OrderRepository orderRepository,
            UserRepository userRepository,
            StatsRepository statsRepository
    ) {
        this.productRepository = productRepository;
        this.orderRepository = orderRepository;
        this.userRepository = userRepository;
        this.statsRepository = statsRepository;
    }

    /**
     * Rebuild all counters from the current entity set and overwrite the stored record.
     *
     * @return Fresh stats
     */
    public Stats recompute() {
        long startTime = System.currentTimeMillis();

        List<Order> orders = orderRepository.list();
        long revenue = orders.stream()
                .filter(Order::isCompleted)
                .mapToLong(order -> order.getTotal() == null ? 0 : order.getTotal())
                .sum();

        Stats stats = Stats.builder()
                .totalOrders(orders.size())
                .totalProducts(productRepository.list().size())
                .totalUsers(userRepository.list().size())
                .totalRevenue(revenue)
                .updatedAt(Instant.now())
                .build();
        statsRepository.save(stats);

        logger.debug("Recomputed stats in {}ms: {} orders, {} products, {} users, revenue {}",
                System.currentTimeMillis() - startTime, stats.getTotalOrders(),
                stats.getTotalProducts(), stats.getTotalUsers(), stats.getTotalRevenue());
        return stats;
    }

    /**
     * @return Stored stats, computed first if none are stored yet
     */
    public Stats get() {
        return statsRepository.find().orElseGet(() -> {
            logger.info("No stats stored yet, computing");
            return recompute();
        });
    }

    @EventListener
    public void onOrderChanged(OrderChangedEvent event) {
        logger.debug("Recomputing stats after {}", event);
        recompute();
    }
}
