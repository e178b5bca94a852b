package com.example.storefront.application.dto;

import com.example.storefront.domain.model.payment.GatewayPaymentOutcome;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A payment outcome reported by the gateway, by webhook or by polling
 */
@Value
@Builder
public class ReconciliationSignal {
    String paymentReference;
    GatewayPaymentOutcome outcome;
    String gatewayReference;
    String paymentMethod;
    BigDecimal amountPaid;
}
