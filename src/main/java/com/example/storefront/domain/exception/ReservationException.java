package com.example.storefront.domain.exception;

import java.util.Map;

/**
 * Stock could not be reserved
 */
public class ReservationException extends DomainException {
    public ReservationException(ErrorKind kind, String errorCode, String message, Map<String, Object> details) {
        super(kind, errorCode, message, details);
    }
}
