package com.example.storefront.application.dto;

import com.example.storefront.domain.model.order.Order;
import com.example.storefront.domain.model.payment.Payment;
import lombok.Value;

/**
 * An order with its payment record; {@code payment} may be null for legacy rows
 */
@Value(staticConstructor = "of")
public class OrderDetails {
    Order order;
    Payment payment;
}
