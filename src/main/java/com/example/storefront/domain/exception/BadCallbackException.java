package com.example.storefront.domain.exception;

public class BadCallbackException extends PaymentException {
    public BadCallbackException(String message) {
        super(ErrorKind.BAD_CALLBACK, "BAD_CALLBACK", message);
    }

    public BadCallbackException(String message, Throwable cause) {
        super(ErrorKind.BAD_CALLBACK, "BAD_CALLBACK", message, cause);
    }
}
