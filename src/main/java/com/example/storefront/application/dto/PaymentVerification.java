package com.example.storefront.application.dto;

import com.example.storefront.domain.model.order.Order;
import com.example.storefront.domain.model.payment.Payment;
import com.example.storefront.domain.model.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PaymentVerification {
    boolean verified;
    PaymentStatus status;
    Payment payment;
    Order order;
}
