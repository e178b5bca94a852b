package com.example.storefront.application.service;

import com.example.storefront.application.dto.ChannelProvisionResult;
import com.example.storefront.application.dto.ReconciliationResult;
import com.example.storefront.application.dto.ReconciliationSignal;
import com.example.storefront.domain.exception.PaymentAlreadyCompletedException;
import com.example.storefront.domain.model.payment.Payment;
import com.example.storefront.domain.model.payment.PaymentStatus;
import com.example.storefront.domain.repository.OrderRepository;
import com.example.storefront.domain.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Applies gateway outcomes to payment records.
 *
 * <ul>
 *   <li>unknown reference: logged, nothing changes</li>
 *   <li>status already equal to the outcome: nothing changes</li>
 *   <li>only a {@code pending} payment accepts a terminal outcome, via a
 *       conditional update; the first terminal outcome wins and later ones are ignored</li>
 *   <li>the winner mirrors the new status onto the order's payment status;
 *       the order's fulfilment status is never touched</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentReconciler {

    private final PaymentRepository paymentRepository;
    private final OrderRepository orderRepository;

    @Transactional
    public ReconciliationResult reconcile(ReconciliationSignal signal) {
        Optional<Payment> found = paymentRepository.findByPaymentReference(signal.getPaymentReference());
        if (found.isEmpty()) {
            log.warn("Payment not found for reference: {}", signal.getPaymentReference());
            return ReconciliationResult.unknownReference(signal.getPaymentReference());
        }

        Payment payment = found.get();
        PaymentStatus current = payment.getStatus();
        PaymentStatus target = signal.getOutcome().toPaymentStatus();
        LocalDateTime now = LocalDateTime.now();

        if (current == target) {
            // a late gateway reference may still be recorded, once
            if (signal.getGatewayReference() != null && payment.getGatewayReference() == null) {
                paymentRepository.assignGatewayReference(payment.getId(), signal.getGatewayReference(), now);
            }
            log.debug("Payment already {}, nothing to do: ref={}", current, payment.getPaymentReference());
            return notApplied(payment, current);
        }

        if (current != PaymentStatus.PENDING) {
            log.warn("Ignoring {} outcome for payment already {}: ref={}",
                    signal.getOutcome(), current, payment.getPaymentReference());
            return notApplied(payment, current);
        }

        int updated = paymentRepository.transitionStatus(
                payment.getId(),
                PaymentStatus.PENDING,
                target,
                signal.getGatewayReference(),
                signal.getPaymentMethod(),
                signal.getAmountPaid(),
                target == PaymentStatus.PAID ? now : null,
                now);

        if (updated == 0) {
            PaymentStatus winner = paymentRepository.findById(payment.getId())
                    .map(Payment::getStatus)
                    .orElse(current);
            log.info("Concurrent reconciliation won by another signal: ref={}, status={}",
                    payment.getPaymentReference(), winner);
            return notApplied(payment, winner);
        }

        orderRepository.updatePaymentStatus(payment.getOrderId(), target, now);

        log.info("Payment reconciled: ref={}, orderId={}, {} -> {}",
                payment.getPaymentReference(), payment.getOrderId(), current, target);

        return ReconciliationResult.builder()
                .paymentReference(payment.getPaymentReference())
                .orderId(payment.getOrderId())
                .applied(true)
                .previousStatus(current)
                .currentStatus(target)
                .build();
    }

    /**
     * Stores a newly provisioned collection channel and reopens the payment.
     *
     * @throws PaymentAlreadyCompletedException if the payment was paid meanwhile
     */
    @Transactional
    public void reopenWithChannel(Payment payment, ChannelProvisionResult channel) {
        LocalDateTime now = LocalDateTime.now();
        int updated = paymentRepository.updateChannel(
                payment.getId(),
                PaymentStatus.PENDING,
                PaymentStatus.PAID,
                channel.getAccountNumber(),
                channel.getAccountName(),
                channel.getBankName(),
                channel.getCheckoutUrl(),
                channel.getExpiresAt(),
                channel.getGatewayReference(),
                now);
        if (updated == 0) {
            throw new PaymentAlreadyCompletedException(payment.getPaymentReference());
        }
        orderRepository.updatePaymentStatus(payment.getOrderId(), PaymentStatus.PENDING, now);
    }

    private ReconciliationResult notApplied(Payment payment, PaymentStatus status) {
        return ReconciliationResult.builder()
                .paymentReference(payment.getPaymentReference())
                .orderId(payment.getOrderId())
                .applied(false)
                .previousStatus(status)
                .currentStatus(status)
                .build();
    }
}
