package com.example.storefront.domain.model.order;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Fulfilment status of an order.
 *
 * <pre>
 * pending -> confirmed -> processing -> shipped -> delivered -> fulfilled
 * pending | confirmed -> cancelled
 * </pre>
 */
public enum OrderStatus {
    PENDING("pending"),
    CONFIRMED("confirmed"),
    PROCESSING("processing"),
    SHIPPED("shipped"),
    DELIVERED("delivered"),
    FULFILLED("fulfilled"),
    CANCELLED("cancelled");

    /**
     * Forward fulfilment progression, used to derive tracking events
     */
    public static final List<OrderStatus> PROGRESSION = List.of(
            PENDING, CONFIRMED, PROCESSING, SHIPPED, DELIVERED, FULFILLED);

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static OrderStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Order status is required");
        }
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown order status: " + value));
    }

    /**
     * Statuses reachable in one step from this one
     */
    public Set<OrderStatus> allowedNext() {
        switch (this) {
            case PENDING:
                return Collections.unmodifiableSet(EnumSet.of(CONFIRMED, CANCELLED));
            case CONFIRMED:
                return Collections.unmodifiableSet(EnumSet.of(PROCESSING, CANCELLED));
            case PROCESSING:
                return Collections.unmodifiableSet(EnumSet.of(SHIPPED));
            case SHIPPED:
                return Collections.unmodifiableSet(EnumSet.of(DELIVERED));
            case DELIVERED:
                return Collections.unmodifiableSet(EnumSet.of(FULFILLED));
            default:
                return Collections.emptySet();
        }
    }

    public boolean canTransitionTo(OrderStatus next) {
        return next != null && allowedNext().contains(next);
    }

    public boolean isCancellable() {
        return this == PENDING || this == CONFIRMED;
    }

    public boolean isTerminal() {
        return allowedNext().isEmpty();
    }
}
