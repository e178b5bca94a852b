package com.example.storefront.domain.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class InsufficientStockException extends ReservationException {

    private final String productId;
    private final int available;
    private final int requested;

    public InsufficientStockException(String productId, String productName, int available, int requested) {
        super(ErrorKind.CONFLICT, "INSUFFICIENT_STOCK",
                "Insufficient stock for " + (productName != null ? productName : productId),
                Map.of("productId", productId, "available", available, "requested", requested));
        this.productId = productId;
        this.available = available;
        this.requested = requested;
    }
}
