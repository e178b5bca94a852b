package com.example.storefront.application.dto;

import com.example.storefront.domain.model.payment.GatewayPaymentOutcome;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class GatewayStatusResult {
    String paymentReference;
    String gatewayReference;
    GatewayPaymentOutcome outcome;
    String paymentMethod;
    BigDecimal amountPaid;
}
