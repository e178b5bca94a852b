package com.example.storefront.domain.exception;

public class PaymentNotFoundException extends ResourceNotFoundException {
    public PaymentNotFoundException(String id) {
        super("PAYMENT_NOT_FOUND", "Payment", id);
    }
}
