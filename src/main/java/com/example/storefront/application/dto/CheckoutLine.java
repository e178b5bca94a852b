package com.example.storefront.application.dto;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One requested cart line. {@code variantSelection} holds the customer's
 * chosen options (size, colour, ...) and is never null.
 */
@Value
public class CheckoutLine {
    String productId;
    int quantity;
    Map<String, String> variantSelection;

    public static CheckoutLine of(String productId, int quantity) {
        return new CheckoutLine(productId, quantity, Collections.emptyMap());
    }

    public static CheckoutLine of(String productId, int quantity, Map<String, String> variantSelection) {
        return new CheckoutLine(productId, quantity, variantSelection == null || variantSelection.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variantSelection)));
    }
}
