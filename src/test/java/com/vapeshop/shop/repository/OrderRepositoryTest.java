package com.vapeshop.shop.repository;

import com.vapeshop.shop.domain.event.OrderChangedEvent;
import com.vapeshop.shop.domain.model.Order;
import com.vapeshop.shop.domain.model.OrderItem;
import com.vapeshop.shop.testutil.InMemoryShop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.vapeshop.shop.testutil.TestDataBuilder.anItem;
import static com.vapeshop.shop.testutil.TestDataBuilder.anOrder;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for OrderRepository against the in-memory store.
 */
@DisplayName("OrderRepository Tests")
class OrderRepositoryTest {

    private InMemoryShop shop;
    private OrderRepository orderRepository;

    @BeforeEach
    void setUp() {
        shop = new InMemoryShop();
        orderRepository = shop.orderRepository;
    }

    @Test
    @DisplayName("save - New order: Should allocate an id and default the status to pending")
    void save_DefaultsToPending() {
        // When
        Order saved = orderRepository.save(anOrder(42L, 900).build());

        // Then
        assertThat(saved.getId()).isEqualTo(1L);
        assertThat(saved.getStatus()).isEqualTo(Order.STATUS_PENDING);
        assertThat(saved.getCreatedAt()).isNotNull();
        assertThat(orderRepository.findById(1).orElseThrow().getStatus()).isEqualTo("pending");
    }

    @Test
    @DisplayName("save - Items: Should be stored and read back as structured items")
    void save_ItemsRoundTrip() {
        // Given
        Order order = anOrder(42L, 1180).items(new ArrayList<>(List.of(
                anItem(1L, 2, 450),
                anItem(3L, 1, 280)
        ))).build();

        // When
        orderRepository.save(order);
        Order loaded = orderRepository.findById(1).orElseThrow();

        // Then
        assertThat(loaded.getItems()).hasSize(2);
        OrderItem first = loaded.getItems().get(0);
        assertThat(first.getProductId()).isEqualTo(1L);
        assertThat(first.getQuantity()).isEqualTo(2);
        assertThat(first.getPrice()).isEqualTo(450);
        assertThat(loaded.getUserId()).isEqualTo(42L);
        assertThat(loaded.getTotal()).isEqualTo(1180);
    }

    @Test
    @DisplayName("list - Several orders: Should return most recent first")
    void list_DescendingById() {
        // Given
        orderRepository.save(anOrder(1L, 100).build());
        orderRepository.save(anOrder(2L, 200).build());
        orderRepository.save(anOrder(1L, 300).build());

        // When
        List<Order> orders = orderRepository.list();

        // Then
        assertThat(orders).extracting(Order::getId).containsExactly(3L, 2L, 1L);
    }

    @Test
    @DisplayName("listByUser - Mixed owners: Should return that user's orders, most recent first")
    void listByUser_FiltersByOwner() {
        // Given
        orderRepository.save(anOrder(42L, 100).build());
        orderRepository.save(anOrder(7L, 200).build());
        orderRepository.save(anOrder(42L, 300).build());

        // When
        List<Order> orders = orderRepository.listByUser(42L);

        // Then
        assertThat(orders).extracting(Order::getId).containsExactly(3L, 1L);
        assertThat(orderRepository.listByUser(99L)).isEmpty();
    }

    @Test
    @DisplayName("updateStatus - Existing order: Should change status and updated_at only")
    void updateStatus_Existing() {
        // Given
        Order saved = orderRepository.save(anOrder(42L, 900).build());
        Instant createdAt = saved.getCreatedAt();

        // When
        boolean updated = orderRepository.updateStatus(saved.getId(), Order.STATUS_COMPLETED);
        Order loaded = orderRepository.findById(saved.getId()).orElseThrow();

        // Then
        assertThat(updated).isTrue();
        assertThat(loaded.getStatus()).isEqualTo("completed");
        assertThat(loaded.getCreatedAt()).isEqualTo(createdAt);
        assertThat(loaded.getUpdatedAt()).isAfterOrEqualTo(saved.getUpdatedAt());
        assertThat(loaded.getItems()).hasSize(1);
        assertThat(loaded.getTotal()).isEqualTo(900);
    }

    @Test
    @DisplayName("updateStatus - Missing order: Should return false and create nothing")
    void updateStatus_Missing() {
        // When
        boolean updated = orderRepository.updateStatus(99L, Order.STATUS_COMPLETED);

        // Then
        assertThat(updated).isFalse();
        assertThat(shop.store.existsKey("order:99")).isFalse();
        assertThat(shop.publishedEvents).isEmpty();
    }

    @Test
    @DisplayName("save / updateStatus - Should publish an order change event for each write")
    void writes_PublishEvents() {
        // When
        Order saved = orderRepository.save(anOrder(42L, 900).build());
        orderRepository.updateStatus(saved.getId(), Order.STATUS_COMPLETED);

        // Then
        assertThat(shop.publishedEvents).extracting(OrderChangedEvent::getChangeType)
                .containsExactly(OrderChangedEvent.ChangeType.SAVED, OrderChangedEvent.ChangeType.STATUS_CHANGED);
        assertThat(shop.publishedEvents).extracting(OrderChangedEvent::getOrderId)
                .containsOnly(saved.getId());
    }
}
