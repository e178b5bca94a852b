package com.example.storefront.application.dto;

import com.example.storefront.domain.model.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReconciliationResult {
    String paymentReference;
    String orderId;
    /**
     * True only for the call that changed the payment status
     */
    boolean applied;
    PaymentStatus previousStatus;
    PaymentStatus currentStatus;

    public static ReconciliationResult unknownReference(String paymentReference) {
        return ReconciliationResult.builder()
                .paymentReference(paymentReference)
                .applied(false)
                .build();
    }
}
