package com.example.storefront.infrastructure.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the payment gateway. Connect and read timeouts bound every
 * outbound call, including the one made while creating an order.
 */
@Configuration
public class RestClientConfig {

    @Bean
    public RestTemplate gatewayRestTemplate(RestTemplateBuilder builder, StorefrontProperties properties) {
        StorefrontProperties.Monnify monnify = properties.getMonnify();
        return builder
                .rootUri(monnify.getBaseUrl())
                .setConnectTimeout(monnify.getConnectTimeout())
                .setReadTimeout(monnify.getReadTimeout())
                .build();
    }
}
