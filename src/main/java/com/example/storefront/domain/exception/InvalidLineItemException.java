package com.example.storefront.domain.exception;

public class InvalidLineItemException extends DomainException {
    public InvalidLineItemException(String message) {
        super(ErrorKind.INVALID_INPUT, "INVALID_LINE_ITEM", message);
    }
}
