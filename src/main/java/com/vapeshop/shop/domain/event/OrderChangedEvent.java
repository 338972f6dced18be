package com.vapeshop.shop.domain.event;

/**
 * Published after an order is saved or its status changes.
 * Listeners run synchronously in the publishing thread.
 *
 * @author Vape Shop Team
 */
public class OrderChangedEvent {

    public enum ChangeType {
        SAVED,
        STATUS_CHANGED
    }

    private final Long orderId;
    private final ChangeType changeType;

    public OrderChangedEvent(Long orderId, ChangeType changeType) {
        this.orderId = orderId;
        this.changeType = changeType;
    }

    public Long getOrderId() {
        return orderId;
    }

    public ChangeType getChangeType() {
        return changeType;
    }

    @Override
    public String toString() {
        return "OrderChangedEvent{orderId=" + orderId + ", changeType=" + changeType + "}";
    }
}
