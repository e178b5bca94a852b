package com.example.storefront.application.service;

import com.example.storefront.application.dto.BankInfo;
import com.example.storefront.application.dto.ChannelProvisionRequest;
import com.example.storefront.application.dto.ChannelProvisionResult;
import com.example.storefront.application.dto.GatewayStatusResult;
import com.example.storefront.application.dto.PaymentVerification;
import com.example.storefront.application.dto.PayoutAccountResult;
import com.example.storefront.application.dto.ReconciliationResult;
import com.example.storefront.application.dto.ReconciliationSignal;
import com.example.storefront.application.dto.WebhookOutcome;
import com.example.storefront.application.event.publisher.OrderEventPublisher;
import com.example.storefront.domain.exception.BadCallbackException;
import com.example.storefront.domain.exception.InvalidTransitionException;
import com.example.storefront.domain.exception.OrderNotFoundException;
import com.example.storefront.domain.exception.PaymentAlreadyCompletedException;
import com.example.storefront.domain.exception.PaymentNotFoundException;
import com.example.storefront.domain.model.order.Order;
import com.example.storefront.domain.model.order.OrderStatus;
import com.example.storefront.domain.model.payment.GatewayPaymentOutcome;
import com.example.storefront.domain.model.payment.Payment;
import com.example.storefront.domain.repository.OrderRepository;
import com.example.storefront.domain.repository.PaymentRepository;
import com.example.storefront.infrastructure.gateway.BankDirectory;
import com.example.storefront.infrastructure.gateway.PaymentGatewayClient;
import com.example.storefront.infrastructure.gateway.WebhookSignatureVerifier;
import com.example.storefront.infrastructure.monitoring.MonitoringService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;

/**
 * Payment operations
 * - reconciliation from webhooks and explicit verification
 * - channel re-provisioning and payout account resolution
 *
 * Database writes happen in {@link PaymentReconciler}; this class talks to the
 * gateway and publishes events after the write has committed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PaymentService {

    static final String SUCCESSFUL_TRANSACTION = "SUCCESSFUL_TRANSACTION";
    static final String FAILED_TRANSACTION = "FAILED_TRANSACTION";
    static final String EXPIRED_TRANSACTION = "EXPIRED_TRANSACTION";

    private final PaymentRepository paymentRepository;
    private final OrderRepository orderRepository;
    private final PaymentReconciler paymentReconciler;
    private final PaymentGatewayClient paymentGatewayClient;
    private final WebhookSignatureVerifier signatureVerifier;
    private final BankDirectory bankDirectory;
    private final OrderEventPublisher orderEventPublisher;
    private final MonitoringService monitoringService;
    private final ObjectMapper objectMapper;

    public ReconciliationResult reconcile(ReconciliationSignal signal) {
        ReconciliationResult result = paymentReconciler.reconcile(signal);

        if (result.isApplied()) {
            monitoringService.recordPaymentReconciled();
            orderEventPublisher.publishPaymentStatusChanged(result.getOrderId(), result.getPaymentReference(),
                    result.getPreviousStatus(), result.getCurrentStatus());
        } else {
            monitoringService.recordDuplicateSignal(signal.getPaymentReference());
        }
        return result;
    }

    /**
     * Live gateway query followed by reconciliation.
     *
     * @throws com.example.storefront.domain.exception.GatewayUnavailableException
     *         if the gateway cannot be reached; the payment is left unchanged
     */
    public PaymentVerification verifyPayment(String paymentReference) {
        Payment payment = getPayment(paymentReference);

        GatewayStatusResult status = paymentGatewayClient.queryStatus(paymentReference);
        reconcile(ReconciliationSignal.builder()
                .paymentReference(paymentReference)
                .outcome(status.getOutcome())
                .gatewayReference(status.getGatewayReference())
                .paymentMethod(status.getPaymentMethod())
                .amountPaid(status.getAmountPaid())
                .build());

        Payment current = getPayment(paymentReference);
        Order order = orderRepository.findById(payment.getOrderId()).orElse(null);

        return PaymentVerification.builder()
                .verified(current.isPaid())
                .status(current.getStatus())
                .payment(current)
                .order(order)
                .build();
    }

    public Payment getPayment(String paymentReference) {
        return paymentRepository.findByPaymentReference(paymentReference)
                .orElseThrow(() -> new PaymentNotFoundException(paymentReference));
    }

    /**
     * Provision a fresh collection channel for an unpaid payment. The payment
     * reference never changes. Cancelled orders have already given their
     * stock back and cannot be paid.
     */
    public Payment reinitializePayment(String paymentReference) {
        Payment payment = getPayment(paymentReference);
        if (payment.isPaid()) {
            throw new PaymentAlreadyCompletedException(paymentReference);
        }

        Order order = orderRepository.findById(payment.getOrderId())
                .orElseThrow(() -> new OrderNotFoundException(payment.getOrderId()));
        if (order.getStatus() == OrderStatus.CANCELLED) {
            log.warn("Rejected payment reinitialization for cancelled order: ref={}, orderId={}",
                    paymentReference, order.getId());
            throw new InvalidTransitionException("Cannot reinitialize payment for a cancelled order",
                    order.getStatus());
        }

        ChannelProvisionResult channel = paymentGatewayClient.provisionChannel(ChannelProvisionRequest.builder()
                .amount(order.getTotal())
                .currency(payment.getCurrency())
                .paymentReference(paymentReference)
                .payerName(order.getCustomerName())
                .payerEmail(order.getCustomerEmail())
                .description("Payment for order " + order.getId())
                .build());

        paymentReconciler.reopenWithChannel(payment, channel);
        log.info("Payment reinitialized: ref={}, orderId={}, previousStatus={}",
                paymentReference, order.getId(), payment.getStatus());

        return getPayment(paymentReference);
    }

    public PayoutAccountResult resolveBankAccount(String accountNumber, String bankCode) {
        PayoutAccountResult result = paymentGatewayClient.validatePayoutAccount(accountNumber, bankCode);
        return result.toBuilder()
                .bankCode(bankCode)
                .bankName(bankDirectory.nameOf(bankCode))
                .build();
    }

    public List<BankInfo> listBanks() {
        return bankDirectory.getBanks();
    }

    /**
     * Monnify callback: verify the signature, parse, reconcile.
     * Transaction events reconcile; every other event type is acknowledged and ignored.
     */
    public WebhookOutcome handleWebhook(byte[] rawBody, String signature) {
        signatureVerifier.verify(rawBody, signature);

        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (IOException e) {
            log.error("Failed to parse webhook data: {}", e.getMessage());
            throw new BadCallbackException("Invalid JSON payload", e);
        }
        if (root == null || !root.isObject()) {
            throw new BadCallbackException("Invalid JSON payload");
        }

        String eventType = root.path("eventType").asText(null);
        JsonNode eventData = root.path("eventData");
        log.info("Received Monnify webhook: {}", eventType);

        GatewayPaymentOutcome outcome;
        if (SUCCESSFUL_TRANSACTION.equals(eventType)) {
            outcome = GatewayPaymentOutcome.parse(eventData.path("paymentStatus").asText(null))
                    .orElse(GatewayPaymentOutcome.PAID);
        } else if (FAILED_TRANSACTION.equals(eventType)) {
            outcome = GatewayPaymentOutcome.FAILED;
        } else if (EXPIRED_TRANSACTION.equals(eventType)) {
            outcome = GatewayPaymentOutcome.EXPIRED;
        } else {
            log.info("Ignored webhook event type: {}", eventType);
            return WebhookOutcome.of(eventType, false);
        }

        String paymentReference = eventData.path("paymentReference").asText(null);
        if (paymentReference == null || paymentReference.isBlank()) {
            throw new BadCallbackException("Webhook is missing eventData.paymentReference");
        }

        ReconciliationResult result = reconcile(ReconciliationSignal.builder()
                .paymentReference(paymentReference)
                .outcome(outcome)
                .gatewayReference(eventData.path("transactionReference").asText(null))
                .paymentMethod(eventData.path("paymentMethod").asText(null))
                .amountPaid(parseAmount(eventData.path("amountPaid")))
                .build());

        log.info("Processed {} for {}: applied={}", eventType, paymentReference, result.isApplied());
        return WebhookOutcome.of(eventType, true);
    }

    private BigDecimal parseAmount(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        try {
            return new BigDecimal(node.asText());
        } catch (NumberFormatException e) {
            throw new BadCallbackException("Invalid amountPaid: " + node.asText(), e);
        }
    }
}
