package com.example.storefront.domain.exception;

public class ProductNotFoundException extends ResourceNotFoundException {
    public ProductNotFoundException(String id) {
        super("PRODUCT_NOT_FOUND", "Product", id);
    }
}
