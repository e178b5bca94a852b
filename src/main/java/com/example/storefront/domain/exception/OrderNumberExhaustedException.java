package com.example.storefront.domain.exception;

import java.util.Map;

public class OrderNumberExhaustedException extends OrderException {
    public OrderNumberExhaustedException(int attempts) {
        super(ErrorKind.INTERNAL, "ORDER_NUMBER_EXHAUSTED",
                "Could not allocate a unique order number", Map.of("attempts", attempts));
    }
}
