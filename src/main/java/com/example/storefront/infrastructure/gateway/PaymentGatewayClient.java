package com.example.storefront.infrastructure.gateway;

import com.example.storefront.application.dto.ChannelProvisionRequest;
import com.example.storefront.application.dto.ChannelProvisionResult;
import com.example.storefront.application.dto.GatewayStatusResult;
import com.example.storefront.application.dto.PayoutAccountResult;
import com.example.storefront.domain.exception.GatewayUnavailableException;
import com.example.storefront.infrastructure.monitoring.MonitoringService;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Entry point for every outbound gateway call.
 * Calls go through the {@code paymentGateway} circuit breaker and any failure
 * comes out as {@link GatewayUnavailableException}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PaymentGatewayClient {

    private final PaymentGatewayFactory gatewayFactory;
    private final CircuitBreaker paymentGatewayCircuitBreaker;
    private final MonitoringService monitoringService;

    public ChannelProvisionResult provisionChannel(ChannelProvisionRequest request) {
        return execute("provisionChannel", () -> gatewayFactory.getGateway().provisionChannel(request));
    }

    public GatewayStatusResult queryStatus(String paymentReference) {
        return execute("queryStatus", () -> gatewayFactory.getGateway().queryStatus(paymentReference));
    }

    public PayoutAccountResult validatePayoutAccount(String accountNumber, String bankCode) {
        return execute("validatePayoutAccount",
                () -> gatewayFactory.getGateway().validatePayoutAccount(accountNumber, bankCode));
    }

    private <T> T execute(String operation, Supplier<T> call) {
        try {
            return paymentGatewayCircuitBreaker.executeSupplier(call);
        } catch (CallNotPermittedException e) {
            monitoringService.recordGatewayFailure(operation);
            log.warn("Payment gateway circuit open, rejecting call: operation={}", operation);
            throw new GatewayUnavailableException("Payment gateway temporarily unavailable", e);
        } catch (GatewayUnavailableException e) {
            monitoringService.recordGatewayFailure(operation);
            log.warn("Payment gateway call failed: operation={}, error={}", operation, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            monitoringService.recordGatewayFailure(operation);
            log.error("Unexpected payment gateway error: operation={}", operation, e);
            throw new GatewayUnavailableException("Payment gateway error: " + e.getMessage(), e);
        }
    }
}
