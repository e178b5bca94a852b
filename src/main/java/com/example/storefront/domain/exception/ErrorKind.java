package com.example.storefront.domain.exception;

/**
 * Stable error categories surfaced to callers
 */
public enum ErrorKind {
    NOT_FOUND,
    FORBIDDEN,
    UNAUTHORIZED,
    INVALID_INPUT,
    CONFLICT,
    INVALID_TRANSITION,
    GATEWAY_ERROR,
    BAD_CALLBACK,
    INTERNAL
}
