package com.vapeshop.shop.service;

import com.vapeshop.shop.domain.model.Order;
import com.vapeshop.shop.exception.ResourceNotFoundException;
import com.vapeshop.shop.exception.ValidationException;
import com.vapeshop.shop.repository.OrderRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.vapeshop.shop.testutil.TestDataBuilder.anItem;
import static com.vapeshop.shop.testutil.TestDataBuilder.anOrder;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OrderService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OrderService Unit Tests")
class OrderServiceTest {

    @Mock
    private OrderRepository orderRepository;

    @InjectMocks
    private OrderService orderService;

    // ========================================
    // createOrder() Tests
    // ========================================

    @Test
    @DisplayName("createOrder - Valid order: Should save it without a client id")
    void createOrder_Valid() {
        // Given
        Order input = anOrder(42L, 900).id(77L).build();
        when(orderRepository.save(any(Order.class))).thenAnswer(invocation -> {
            Order order = invocation.getArgument(0);
            assertThat(order.getId()).isNull();
            order.setId(1L);
            order.setStatus(Order.STATUS_PENDING);
            return order;
        });

        // When
        Order created = orderService.createOrder(input);

        // Then
        assertThat(created.getId()).isEqualTo(1L);
        assertThat(created.getStatus()).isEqualTo("pending");
    }

    @Test
    @DisplayName("createOrder - No items: Should throw ValidationException")
    void createOrder_NoItems() {
        // Given
        Order input = anOrder(42L, 900).items(new ArrayList<>()).build();

        // When / Then
        assertThatThrownBy(() -> orderService.createOrder(input))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("items");
        verify(orderRepository, never()).save(any());
    }

    @Test
    @DisplayName("createOrder - Zero quantity: Should throw ValidationException")
    void createOrder_ZeroQuantity() {
        // Given
        Order input = anOrder(42L, 900).items(new ArrayList<>(List.of(anItem(1L, 0, 450)))).build();

        // When / Then
        assertThatThrownBy(() -> orderService.createOrder(input))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("createOrder - Missing user: Should throw ValidationException")
    void createOrder_MissingUser() {
        // Given
        Order input = anOrder(42L, 900).userId(null).build();

        // When / Then
        assertThatThrownBy(() -> orderService.createOrder(input))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("userId");
    }

    // ========================================
    // updateStatus() Tests
    // ========================================

    @Test
    @DisplayName("updateStatus - Mixed case status: Should store it trimmed and lower-case")
    void updateStatus_Normalizes() {
        // Given
        Order stored = anOrder(42L, 900).id(5L).status(Order.STATUS_COMPLETED).build();
        when(orderRepository.updateStatus(5L, "completed")).thenReturn(true);
        when(orderRepository.findById(5L)).thenReturn(Optional.of(stored));

        // When
        Order updated = orderService.updateStatus(5L, " Completed ");

        // Then
        assertThat(updated.getStatus()).isEqualTo("completed");
        verify(orderRepository).updateStatus(5L, "completed");
    }

    @Test
    @DisplayName("updateStatus - Missing order: Should throw ResourceNotFoundException")
    void updateStatus_Missing() {
        // Given
        when(orderRepository.updateStatus(anyLong(), anyString())).thenReturn(false);

        // When / Then
        assertThatThrownBy(() -> orderService.updateStatus(99L, "completed"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("updateStatus - Blank status: Should throw ValidationException")
    void updateStatus_Blank() {
        assertThatThrownBy(() -> orderService.updateStatus(5L, ""))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(orderRepository);
    }
}
