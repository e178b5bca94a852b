package com.example.storefront.infrastructure.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Business counters exposed through Actuator / Prometheus
 */
@Service
@Slf4j
public class MonitoringService {

    private final Counter ordersCreated;
    private final Counter stockConflicts;
    private final Counter paymentsReconciled;
    private final Counter duplicateSignals;
    private final Counter gatewayFailures;

    public MonitoringService(MeterRegistry registry) {
        this.ordersCreated = Counter.builder("storefront.orders.created")
                .description("Orders persisted")
                .register(registry);
        this.stockConflicts = Counter.builder("storefront.stock.conflicts")
                .description("Reservations rejected for insufficient stock")
                .register(registry);
        this.paymentsReconciled = Counter.builder("storefront.payments.reconciled")
                .description("Payment status changes applied")
                .register(registry);
        this.duplicateSignals = Counter.builder("storefront.payments.duplicate_signals")
                .description("Reconciliation signals that changed nothing")
                .register(registry);
        this.gatewayFailures = Counter.builder("storefront.gateway.failures")
                .description("Failed payment gateway calls")
                .register(registry);
    }

    public void recordOrderCreated() {
        ordersCreated.increment();
    }

    public void recordStockConflict(String productId) {
        stockConflicts.increment();
        log.debug("Stock conflict recorded: productId={}", productId);
    }

    public void recordPaymentReconciled() {
        paymentsReconciled.increment();
    }

    public void recordDuplicateSignal(String paymentReference) {
        duplicateSignals.increment();
        log.debug("Duplicate payment signal: ref={}", paymentReference);
    }

    public void recordGatewayFailure(String operation) {
        gatewayFailures.increment();
        log.debug("Gateway failure recorded: operation={}", operation);
    }
}
