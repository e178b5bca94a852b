package com.example.storefront.domain.exception;

public class OrderNotFoundException extends ResourceNotFoundException {
    public OrderNotFoundException(String id) {
        super("ORDER_NOT_FOUND", "Order", id);
    }
}
