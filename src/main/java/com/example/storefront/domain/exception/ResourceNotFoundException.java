package com.example.storefront.domain.exception;

import java.util.Map;

public abstract class ResourceNotFoundException extends DomainException {

    protected ResourceNotFoundException(String errorCode, String resourceType, String resourceId) {
        super(ErrorKind.NOT_FOUND, errorCode, resourceType + " not found",
                Map.of("resourceType", resourceType, "resourceId", String.valueOf(resourceId)));
    }
}
