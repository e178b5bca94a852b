package com.example.storefront.application.dto;

import com.example.storefront.domain.model.order.Order;
import com.example.storefront.domain.model.payment.Payment;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a checkout. The order always exists; {@code paymentInitialized}
 * is false when the gateway could not provision a collection channel.
 */
@Value
@Builder
public class CheckoutResult {
    Order order;
    Payment payment;
    boolean paymentInitialized;
    String message;
}
