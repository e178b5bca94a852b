package com.example.storefront.domain.service;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of pricing a cart. {@code total == subtotal - discount + shippingFee + platformFee}
 * holds exactly.
 */
@Value
@Builder
public class PriceBreakdown {
    BigDecimal subtotal;
    BigDecimal discount;
    BigDecimal shippingFee;
    BigDecimal platformFee;
    BigDecimal total;
}
