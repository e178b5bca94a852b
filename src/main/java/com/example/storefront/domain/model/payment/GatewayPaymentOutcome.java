package com.example.storefront.domain.model.payment;

import java.util.Arrays;
import java.util.Optional;

/**
 * Payment outcome as reported by the gateway, before it is folded onto the
 * local {@link PaymentStatus}.
 */
public enum GatewayPaymentOutcome {
    PAID(PaymentStatus.PAID),
    OVERPAID(PaymentStatus.PAID),
    PARTIALLY_PAID(PaymentStatus.PENDING),
    PENDING(PaymentStatus.PENDING),
    FAILED(PaymentStatus.FAILED),
    EXPIRED(PaymentStatus.EXPIRED);

    private final PaymentStatus paymentStatus;

    GatewayPaymentOutcome(PaymentStatus paymentStatus) {
        this.paymentStatus = paymentStatus;
    }

    public PaymentStatus toPaymentStatus() {
        return paymentStatus;
    }

    /**
     * Lenient parse of gateway spellings ("PAID", "paid", "partially_paid", "PARTIALLY-PAID")
     */
    public static Optional<GatewayPaymentOutcome> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        return Arrays.stream(values())
                .filter(o -> o.name().equals(normalized))
                .findFirst();
    }
}
