package com.example.storefront.domain.repository;

import com.example.storefront.domain.model.payment.Payment;
import com.example.storefront.domain.model.payment.PaymentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Payment repository
 */
@Repository
public interface PaymentRepository extends JpaRepository<Payment, String> {

    Optional<Payment> findByPaymentReference(String paymentReference);

    Optional<Payment> findByOrderId(String orderId);

    Optional<Payment> findByGatewayReference(String gatewayReference);

    /**
     * Single-row conditional status change. Only succeeds while the row still
     * holds {@code expected}, so of several concurrent signals exactly one wins.
     * Gateway reference and method are written only if not already set.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Payment p SET p.status = :next, p.paidAt = :paidAt, p.amountPaid = :amountPaid, " +
            "p.gatewayReference = COALESCE(p.gatewayReference, :gatewayReference), " +
            "p.paymentMethod = COALESCE(p.paymentMethod, :paymentMethod), " +
            "p.updatedAt = :now " +
            "WHERE p.id = :paymentId AND p.status = :expected")
    int transitionStatus(@Param("paymentId") String paymentId,
                         @Param("expected") PaymentStatus expected,
                         @Param("next") PaymentStatus next,
                         @Param("gatewayReference") String gatewayReference,
                         @Param("paymentMethod") String paymentMethod,
                         @Param("amountPaid") BigDecimal amountPaid,
                         @Param("paidAt") LocalDateTime paidAt,
                         @Param("now") LocalDateTime now);

    /**
     * Set-once assignment of the gateway reference
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Payment p SET p.gatewayReference = :gatewayReference, p.updatedAt = :now " +
            "WHERE p.id = :paymentId AND p.gatewayReference IS NULL")
    int assignGatewayReference(@Param("paymentId") String paymentId,
                               @Param("gatewayReference") String gatewayReference,
                               @Param("now") LocalDateTime now);

    /**
     * Stores a freshly provisioned collection channel and reopens the payment
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Payment p SET p.status = :pending, p.accountNumber = :accountNumber, " +
            "p.accountName = :accountName, p.bankName = :bankName, p.checkoutUrl = :checkoutUrl, " +
            "p.expiresAt = :expiresAt, " +
            "p.gatewayReference = COALESCE(p.gatewayReference, :gatewayReference), p.updatedAt = :now " +
            "WHERE p.id = :paymentId AND p.status <> :paid")
    int updateChannel(@Param("paymentId") String paymentId,
                      @Param("pending") PaymentStatus pending,
                      @Param("paid") PaymentStatus paid,
                      @Param("accountNumber") String accountNumber,
                      @Param("accountName") String accountName,
                      @Param("bankName") String bankName,
                      @Param("checkoutUrl") String checkoutUrl,
                      @Param("expiresAt") LocalDateTime expiresAt,
                      @Param("gatewayReference") String gatewayReference,
                      @Param("now") LocalDateTime now);
}
