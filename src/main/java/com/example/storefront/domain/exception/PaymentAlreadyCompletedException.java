package com.example.storefront.domain.exception;

import java.util.Map;

public class PaymentAlreadyCompletedException extends PaymentException {
    public PaymentAlreadyCompletedException(String paymentReference) {
        super(ErrorKind.CONFLICT, "PAYMENT_ALREADY_COMPLETED", "Payment already completed",
                Map.of("paymentReference", paymentReference));
    }
}
