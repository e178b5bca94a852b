package com.example.storefront.domain.model.payment;

import com.example.storefront.domain.model.common.BaseEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Payment record, one per order.
 * {@code paymentReference} is generated locally before any gateway call and is
 * the idempotency key for everything downstream. {@code gatewayReference} is
 * assigned at most once.
 */
@Entity
@Table(name = "payments", indexes = {
        @Index(name = "idx_payment_gateway_reference", columnList = "gateway_reference"),
        @Index(name = "idx_payment_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payment extends BaseEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "order_id", nullable = false, unique = true, length = 36)
    private String orderId;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "payment_reference", nullable = false, unique = true, updatable = false, length = 100)
    private String paymentReference;

    @Column(name = "gateway_reference", length = 100)
    private String gatewayReference;

    @Column(name = "payment_method", length = 30)
    private String paymentMethod;

    @Column(name = "amount_paid", precision = 12, scale = 2)
    private BigDecimal amountPaid;

    @Column(name = "checkout_url", length = 500)
    private String checkoutUrl;

    @Column(name = "account_number", length = 20)
    private String accountNumber;

    @Column(name = "account_name")
    private String accountName;

    @Column(name = "bank_name", length = 100)
    private String bankName;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    public boolean isPaid() {
        return status == PaymentStatus.PAID;
    }

    /**
     * A collection channel (account or checkout link) has been provisioned
     */
    public boolean hasChannel() {
        return (accountNumber != null && !accountNumber.isBlank())
                || (checkoutUrl != null && !checkoutUrl.isBlank());
    }
}
