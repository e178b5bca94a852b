package com.example.storefront.application.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ChannelProvisionRequest {
    BigDecimal amount;
    String currency;
    String paymentReference;
    String payerName;
    String payerEmail;
    String description;
}
