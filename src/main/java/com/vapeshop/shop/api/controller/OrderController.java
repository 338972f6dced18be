package com.vapeshop.shop.api.controller;

import com.vapeshop.shop.api.dto.OrderRequest;
import com.vapeshop.shop.api.dto.StatusUpdateRequest;
import com.vapeshop.shop.domain.model.Order;
import com.vapeshop.shop.security.SecurityUtils;
import com.vapeshop.shop.service.OrderService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for checkout and order management.
 *
 * Authorization: users see and change their own orders; admins see and change all.
 *
 * @author Vape Shop Team
 */
@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private static final Logger logger = LoggerFactory.getLogger(OrderController.class);

    private final OrderService orderService;

    public OrderController(OrderService orderService) {
        this.orderService = orderService;
    }

    /**
     * Place an order for the caller (or, for admins, for any user).
     *
     * @param request Order contents
     * @return Created order
     */
    @PostMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Order> createOrder(@Valid @RequestBody OrderRequest request) {
        SecurityUtils.verifyUserAccess(request.getUserId());
        Order order = orderService.createOrder(request.toOrder());
        logger.info("Checkout completed - order: {}, user: {}", order.getId(), order.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(order);
    }

    /**
     * All orders, most recent first (admin).
     */
    @GetMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<List<Order>> listOrders() {
        return ResponseEntity.ok(orderService.listOrders());
    }

    /**
     * Orders of one user, most recent first.
     */
    @GetMapping("/{userId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<Order>> getUserOrders(@PathVariable long userId) {
        SecurityUtils.verifyUserAccess(userId);
        logger.debug("Fetching orders for user: {}", userId);
        return ResponseEntity.ok(orderService.listUserOrders(userId));
    }

    /**
     * Change an order's status. Allowed for the order's owner and for admins.
     */
    @PutMapping("/{id}/status")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Order> updateStatus(
            @PathVariable long id,
            @Valid @RequestBody StatusUpdateRequest request
    ) {
        Order order = orderService.getOrder(id);
        SecurityUtils.verifyUserAccess(order.getUserId());

        Order updated = orderService.updateStatus(id, request.getStatus());
        logger.info("User {} changed order {} status to {}",
                SecurityUtils.getCurrentUserId(), id, updated.getStatus());
        return ResponseEntity.ok(updated);
    }
}
