package com.example.storefront.infrastructure.config;

import com.example.storefront.domain.service.PricingEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PricingConfig {

    @Bean
    public PricingEngine pricingEngine(StorefrontProperties properties) {
        return new PricingEngine(properties.getPlatformFeePercentage());
    }
}
