package com.example.storefront.domain.exception;

import com.example.storefront.domain.model.order.OrderStatus;

import java.util.Map;

public class InvalidTransitionException extends OrderException {

    public InvalidTransitionException(OrderStatus from, OrderStatus to) {
        super(ErrorKind.INVALID_TRANSITION, "INVALID_TRANSITION",
                "Cannot transition from " + from.getValue() + " to " + to.getValue(),
                Map.of("from", from.getValue(), "to", to.getValue()));
    }

    public InvalidTransitionException(String message, OrderStatus current) {
        super(ErrorKind.INVALID_TRANSITION, "INVALID_TRANSITION", message,
                Map.of("status", current.getValue()));
    }
}
