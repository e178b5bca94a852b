package com.example.storefront.infrastructure.gateway;

import com.example.storefront.application.dto.GatewayStatusResult;
import com.example.storefront.domain.exception.GatewayUnavailableException;
import com.example.storefront.domain.model.payment.GatewayPaymentOutcome;
import com.example.storefront.domain.service.PaymentGatewayService;
import com.example.storefront.infrastructure.monitoring.MonitoringService;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PaymentGatewayClientTest {

    private PaymentGatewayService gateway;
    private CircuitBreaker circuitBreaker;
    private SimpleMeterRegistry registry;
    private PaymentGatewayClient client;

    @BeforeEach
    void setUp() {
        gateway = mock(PaymentGatewayService.class);
        PaymentGatewayFactory factory = mock(PaymentGatewayFactory.class);
        when(factory.getGateway()).thenReturn(gateway);

        circuitBreaker = CircuitBreaker.of("test", CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(2)
                .minimumNumberOfCalls(2)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofMinutes(1))
                .build());
        registry = new SimpleMeterRegistry();
        client = new PaymentGatewayClient(factory, circuitBreaker, new MonitoringService(registry));
    }

    @Test
    void passesSuccessfulResultsThrough() {
        GatewayStatusResult pending = GatewayStatusResult.builder()
                .paymentReference("PAY-1")
                .outcome(GatewayPaymentOutcome.PENDING)
                .build();
        when(gateway.queryStatus("PAY-1")).thenReturn(pending);

        assertSame(pending, client.queryStatus("PAY-1"));
        assertEquals(0.0, registry.counter("storefront.gateway.failures").count());
    }

    @Test
    void unexpectedErrorsBecomeGatewayUnavailable() {
        IllegalStateException cause = new IllegalStateException("connection reset");
        when(gateway.queryStatus("PAY-1")).thenThrow(cause);

        GatewayUnavailableException ex = assertThrows(GatewayUnavailableException.class,
                () -> client.queryStatus("PAY-1"));

        assertSame(cause, ex.getCause());
        assertEquals(1.0, registry.counter("storefront.gateway.failures").count());
    }

    @Test
    void gatewayUnavailableIsNotWrappedTwice() {
        GatewayUnavailableException original = new GatewayUnavailableException("Failed to validate bank account");
        when(gateway.validatePayoutAccount("0123456789", "058")).thenThrow(original);

        assertSame(original, assertThrows(GatewayUnavailableException.class,
                () -> client.validatePayoutAccount("0123456789", "058")));
    }

    @Test
    void openCircuitRejectsWithoutCallingGateway() {
        when(gateway.queryStatus("PAY-1")).thenThrow(new IllegalStateException("timeout"));

        assertThrows(GatewayUnavailableException.class, () -> client.queryStatus("PAY-1"));
        assertThrows(GatewayUnavailableException.class, () -> client.queryStatus("PAY-1"));
        assertEquals(CircuitBreaker.State.OPEN, circuitBreaker.getState());

        GatewayUnavailableException rejected = assertThrows(GatewayUnavailableException.class,
                () -> client.queryStatus("PAY-1"));

        assertInstanceOf(CallNotPermittedException.class, rejected.getCause());
        verify(gateway, times(2)).queryStatus("PAY-1");
        assertEquals(3.0, registry.counter("storefront.gateway.failures").count());
    }
}
