package com.example.storefront.domain.exception;

/**
 * The payment gateway was unreachable or rejected the request
 */
public class GatewayUnavailableException extends PaymentException {
    public GatewayUnavailableException(String message) {
        super(ErrorKind.GATEWAY_ERROR, "GATEWAY_UNAVAILABLE", message);
    }

    public GatewayUnavailableException(String message, Throwable cause) {
        super(ErrorKind.GATEWAY_ERROR, "GATEWAY_UNAVAILABLE", message, cause);
    }
}
