package com.example.storefront.domain.exception;

public class StoreNotFoundException extends ResourceNotFoundException {
    public StoreNotFoundException(String id) {
        super("STORE_NOT_FOUND", "Store", id);
    }
}
