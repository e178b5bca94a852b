package com.example.storefront.application.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Public checkout against a store identified by its username
 */
@Value
@Builder
public class CheckoutCommand {
    String storeUsername;
    CustomerDetails customer;
    @Singular
    List<CheckoutLine> lines;
    @Builder.Default
    BigDecimal discount = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal shippingFee = BigDecimal.ZERO;
    String notes;
}
