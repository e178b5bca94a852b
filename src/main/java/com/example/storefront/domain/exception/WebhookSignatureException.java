package com.example.storefront.domain.exception;

public class WebhookSignatureException extends PaymentException {
    public WebhookSignatureException(String message) {
        super(ErrorKind.UNAUTHORIZED, "INVALID_SIGNATURE", message);
    }
}
