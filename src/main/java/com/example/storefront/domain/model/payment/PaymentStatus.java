package com.example.storefront.domain.model.payment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Payment status, kept on both the payment row and the order row.
 * {@code paid}, {@code failed} and {@code expired} are terminal for
 * reconciliation; only {@code pending} accepts a gateway outcome.
 */
public enum PaymentStatus {
    PENDING("pending"),
    PAID("paid"),
    FAILED("failed"),
    EXPIRED("expired"),
    REFUNDED("refunded");

    private final String value;

    PaymentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PaymentStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Payment status is required");
        }
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown payment status: " + value));
    }

    public boolean isFinal() {
        return this != PENDING;
    }
}
