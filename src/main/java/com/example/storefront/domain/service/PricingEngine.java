package com.example.storefront.domain.service;

import com.example.storefront.domain.exception.InvalidLineItemException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;

/**
 * Cart pricing.
 *
 * <p>Subtotal and platform fee keep full precision; only the grand total is
 * rounded (2 places, half-up). The reported platform fee is the amount that
 * makes the total identity exact after rounding.
 */
public class PricingEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int MONEY_SCALE = 2;

    private final BigDecimal feePercentage;

    public PricingEngine(BigDecimal feePercentage) {
        Objects.requireNonNull(feePercentage, "feePercentage");
        if (feePercentage.signum() < 0) {
            throw new IllegalArgumentException("Platform fee percentage must not be negative: " + feePercentage);
        }
        this.feePercentage = feePercentage;
    }

    public BigDecimal getFeePercentage() {
        return feePercentage;
    }

    public PriceBreakdown computeTotals(List<PricedLine> lines, BigDecimal discount, BigDecimal shippingFee) {
        BigDecimal safeDiscount = discount == null ? BigDecimal.ZERO : discount;
        BigDecimal safeShipping = shippingFee == null ? BigDecimal.ZERO : shippingFee;
        if (safeDiscount.signum() < 0 || safeShipping.signum() < 0) {
            throw new InvalidLineItemException("Discount and shipping fee must not be negative");
        }

        BigDecimal subtotal = BigDecimal.ZERO;
        for (PricedLine line : lines) {
            if (line.getQuantity() <= 0) {
                throw new InvalidLineItemException("Quantity must be positive, got " + line.getQuantity());
            }
            if (line.getUnitPrice() == null || line.getUnitPrice().signum() < 0) {
                throw new InvalidLineItemException("Price must be non-negative, got " + line.getUnitPrice());
            }
            subtotal = subtotal.add(line.getUnitPrice().multiply(BigDecimal.valueOf(line.getQuantity())));
        }

        // exact: HUNDRED divides any finite decimal without a repeating expansion
        BigDecimal rawFee = subtotal.multiply(feePercentage).divide(HUNDRED);

        BigDecimal total = subtotal.subtract(safeDiscount).add(safeShipping).add(rawFee)
                .setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        if (total.signum() < 0) {
            throw new InvalidLineItemException("Discount " + safeDiscount + " exceeds the order value");
        }
        BigDecimal platformFee = total.subtract(subtotal).add(safeDiscount).subtract(safeShipping);

        return PriceBreakdown.builder()
                .subtotal(subtotal)
                .discount(safeDiscount)
                .shippingFee(safeShipping)
                .platformFee(platformFee)
                .total(total)
                .build();
    }
}
