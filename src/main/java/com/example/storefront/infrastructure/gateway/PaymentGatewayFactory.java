package com.example.storefront.infrastructure.gateway;

import com.example.storefront.domain.service.PaymentGatewayService;
import com.example.storefront.infrastructure.config.StorefrontProperties;
import com.example.storefront.infrastructure.gateway.monnify.MonnifyPaymentGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Payment gateway factory
 * - Spring injects every PaymentGatewayService implementation
 * - Monnify when an API key is configured, the mock gateway otherwise
 */
@Component
@Slf4j
public class PaymentGatewayFactory {

    private final Map<String, PaymentGatewayService> gatewayMap;
    private final String activeGateway;

    public PaymentGatewayFactory(List<PaymentGatewayService> gateways, StorefrontProperties properties) {
        this.gatewayMap = gateways.stream()
                .collect(Collectors.toMap(PaymentGatewayService::getGatewayName, Function.identity()));
        this.activeGateway = properties.getMonnify().isConfigured()
                ? MonnifyPaymentGateway.NAME
                : MockPaymentGateway.NAME;

        log.info("Initialized payment gateways: {}", gatewayMap.keySet());
        log.info("Active gateway: {}", activeGateway);
        if (MockPaymentGateway.NAME.equals(activeGateway) && properties.isProduction()) {
            log.warn("No Monnify API key configured in production; payments run against the mock gateway");
        }
    }

    public PaymentGatewayService getGateway() {
        PaymentGatewayService gateway = gatewayMap.get(activeGateway);
        if (gateway == null) {
            throw new IllegalStateException(
                    String.format("Payment gateway %s not available. Available gateways: %s",
                            activeGateway, gatewayMap.keySet()));
        }
        return gateway;
    }

    public String getActiveGatewayName() {
        return activeGateway;
    }
}
