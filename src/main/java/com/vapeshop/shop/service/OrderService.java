package com.vapeshop.shop.service;

import com.vapeshop.shop.domain.model.Order;
import com.vapeshop.shop.domain.model.OrderItem;
import com.vapeshop.shop.exception.ResourceNotFoundException;
import com.vapeshop.shop.exception.ValidationException;
import com.vapeshop.shop.repository.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Checkout and order status handling.
 * Stats are refreshed by the repository's order events, not here.
 *
 * @author Vape Shop Team
 */
@Service
public class OrderService {

    private static final Logger logger = LoggerFactory.getLogger(OrderService.class);

    private final OrderRepository orderRepository;

    public OrderService(OrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    /**
     * Place an order. Any id or timestamps in the input are ignored.
     *
     * @param order Order with userId, at least one item and a total
     * @return Stored order
     * @throws ValidationException if a required field is missing or malformed
     */
    public Order createOrder(Order order) {
        if (order.getUserId() == null) {
            throw new ValidationException("userId", "Field 'userId' is required");
        }
        if (order.getItems() == null || order.getItems().isEmpty()) {
            throw new ValidationException("items", "Order must contain at least one item");
        }
        for (OrderItem item : order.getItems()) {
            if (item.getQuantity() == null || item.getQuantity() <= 0) {
                throw new ValidationException("items", "Item quantity must be positive");
            }
        }
        if (order.getTotal() == null || order.getTotal() < 0) {
            throw new ValidationException("total", "Field 'total' is required and must not be negative");
        }

        order.setId(null);
        order.setCreatedAt(null);
        if (order.getStatus() != null) {
            order.setStatus(normalizeStatus(order.getStatus()));
        }
        Order saved = orderRepository.save(order);
        logger.info("Order {} placed by user {} with {} items", saved.getId(), saved.getUserId(), saved.getItems().size());
        return saved;
    }

    /**
     * @param id Order id
     * @return The order
     * @throws ResourceNotFoundException if there is no such order
     */
    public Order getOrder(long id) {
        return orderRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Order", id));
    }

    public List<Order> listOrders() {
        return orderRepository.list();
    }

    public List<Order> listUserOrders(long userId) {
        return orderRepository.listByUser(userId);
    }

    /**
     * Change the status of an order.
     *
     * @param id Order id
     * @param status New status, any non-blank value
     * @return Order as stored after the change
     * @throws ResourceNotFoundException if there is no such order
     */
    public Order updateStatus(long id, String status) {
        if (status == null || status.isBlank()) {
            throw new ValidationException("status", "Field 'status' is required");
        }
        if (!orderRepository.updateStatus(id, normalizeStatus(status))) {
            throw new ResourceNotFoundException("Order", id);
        }
        return getOrder(id);
    }

    // Revenue matches on the lower-case form, so every write path stores it that way
    private static String normalizeStatus(String status) {
        return status.trim().toLowerCase(Locale.ROOT);
    }
}
