package com.example.storefront.domain.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of all business failures. Carries a stable kind and error code plus
 * structured details for the API layer.
 */
@Getter
public abstract class DomainException extends RuntimeException {

    private final ErrorKind kind;
    private final String errorCode;
    private final Map<String, Object> details;

    protected DomainException(ErrorKind kind, String errorCode, String message) {
        this(kind, errorCode, message, Collections.emptyMap(), null);
    }

    protected DomainException(ErrorKind kind, String errorCode, String message, Map<String, Object> details) {
        this(kind, errorCode, message, details, null);
    }

    protected DomainException(ErrorKind kind, String errorCode, String message,
                              Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.errorCode = errorCode;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
