package com.example.storefront.presentation.dto.response;

import com.example.storefront.application.dto.PaymentVerification;
import com.example.storefront.domain.model.order.Order;
import com.example.storefront.domain.model.order.OrderStatus;
import com.example.storefront.domain.model.payment.PaymentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerifyPaymentResponse {

    private boolean verified;
    private PaymentStatus status;
    private PaymentResponse payment;
    private OrderSummary order;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OrderSummary {
        private String id;
        private String orderNumber;
        private BigDecimal total;
        private OrderStatus status;
        private PaymentStatus paymentStatus;

        static OrderSummary from(Order order) {
            if (order == null) {
                return null;
            }
            return OrderSummary.builder()
                    .id(order.getId())
                    .orderNumber(order.getOrderNumber())
                    .total(order.getTotal())
                    .status(order.getStatus())
                    .paymentStatus(order.getPaymentStatus())
                    .build();
        }
    }

    public static VerifyPaymentResponse from(PaymentVerification verification) {
        return VerifyPaymentResponse.builder()
                .verified(verification.isVerified())
                .status(verification.getStatus())
                .payment(PaymentResponse.from(verification.getPayment()))
                .order(OrderSummary.from(verification.getOrder()))
                .build();
    }
}
