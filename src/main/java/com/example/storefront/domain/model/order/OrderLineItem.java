package com.example.storefront.domain.model.order;

import com.example.storefront.domain.exception.InvalidLineItemException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time snapshot of a purchased product. Captured when the order is
 * created and never updated afterwards, whatever happens to the product.
 *
 * <p>Stored layout (one JSON object per line, in order):
 * {@code {"product_id", "product_name", "product_image", "product_price", "quantity", "subtotal",
 * "variant_selection"}}. {@code variant_selection} is omitted when the customer chose no options.
 */
@Value
@Builder
@Jacksonized
public class OrderLineItem {

    @JsonProperty("product_id")
    String productId;

    @JsonProperty("product_name")
    String productName;

    @JsonProperty("product_image")
    String productImage;

    @JsonProperty("product_price")
    BigDecimal unitPrice;

    @JsonProperty("quantity")
    int quantity;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("variant_selection")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    Map<String, String> variantSelection;

    public static OrderLineItem snapshot(String productId, String productName, String productImage,
                                         BigDecimal unitPrice, int quantity) {
        return snapshot(productId, productName, productImage, unitPrice, quantity, null);
    }

    public static OrderLineItem snapshot(String productId, String productName, String productImage,
                                         BigDecimal unitPrice, int quantity, Map<String, String> variantSelection) {
        OrderLineItem item = OrderLineItem.builder()
                .productId(productId)
                .productName(productName)
                .productImage(productImage)
                .unitPrice(unitPrice)
                .quantity(quantity)
                .subtotal(unitPrice == null ? null : unitPrice.multiply(BigDecimal.valueOf(quantity)))
                .variantSelection(variantSelection == null || variantSelection.isEmpty()
                        ? Collections.emptyMap()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(variantSelection)))
                .build();
        item.validate();
        return item;
    }

    /**
     * Structural check used both on creation and when reading the stored JSON back
     */
    public void validate() {
        if (productId == null || productId.isBlank()) {
            throw new InvalidLineItemException("Line item is missing product id");
        }
        if (productName == null || productName.isBlank()) {
            throw new InvalidLineItemException("Line item is missing product name: " + productId);
        }
        if (unitPrice == null || unitPrice.signum() < 0) {
            throw new InvalidLineItemException("Line item price must be non-negative: " + productId);
        }
        if (quantity <= 0) {
            throw new InvalidLineItemException("Line item quantity must be positive: " + productId);
        }
        if (subtotal == null || subtotal.compareTo(unitPrice.multiply(BigDecimal.valueOf(quantity))) != 0) {
            throw new InvalidLineItemException("Line item subtotal does not match price x quantity: " + productId);
        }
    }
}
