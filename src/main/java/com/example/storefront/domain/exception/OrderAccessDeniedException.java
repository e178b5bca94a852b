package com.example.storefront.domain.exception;

public class OrderAccessDeniedException extends OrderException {
    public OrderAccessDeniedException() {
        super(ErrorKind.FORBIDDEN, "FORBIDDEN", "You don't have access to this order");
    }
}
