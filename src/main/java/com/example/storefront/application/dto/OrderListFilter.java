package com.example.storefront.application.dto;

import com.example.storefront.domain.model.order.OrderStatus;
import com.example.storefront.domain.model.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Optional filters for the owner's order list. Every field may be null.
 * {@code search} matches order number, customer name or customer email,
 * ignoring case. {@code dateFrom} and {@code dateTo} are inclusive calendar days.
 */
@Value
@Builder
public class OrderListFilter {
    String storeId;
    OrderStatus status;
    PaymentStatus paymentStatus;
    String search;
    LocalDate dateFrom;
    LocalDate dateTo;

    public static OrderListFilter none() {
        return OrderListFilter.builder().build();
    }
}
