package com.example.storefront.domain.exception;

import java.util.Map;

public class PaymentException extends DomainException {
    public PaymentException(ErrorKind kind, String errorCode, String message) {
        super(kind, errorCode, message);
    }

    public PaymentException(ErrorKind kind, String errorCode, String message, Map<String, Object> details) {
        super(kind, errorCode, message, details);
    }

    public PaymentException(ErrorKind kind, String errorCode, String message, Throwable cause) {
        super(kind, errorCode, message, Map.of(), cause);
    }
}
