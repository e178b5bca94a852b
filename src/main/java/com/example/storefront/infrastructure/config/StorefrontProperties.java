package com.example.storefront.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "storefront")
public class StorefrontProperties {

    /**
     * {@code development} or {@code production}. Webhook signatures are only
     * enforced in production.
     */
    private String environment = "development";
    private BigDecimal platformFeePercentage = new BigDecimal("2.5");
    private String currency = "NGN";

    private Orders orders = new Orders();
    private Payments payments = new Payments();
    private Monnify monnify = new Monnify();
    private Events events = new Events();

    public boolean isProduction() {
        return "production".equalsIgnoreCase(environment);
    }

    @Data
    public static class Orders {
        private int orderNumberMaxAttempts = 10;
    }

    @Data
    public static class Payments {
        private Duration channelValidity = Duration.ofHours(24);
    }

    @Data
    public static class Monnify {
        private String baseUrl = "https://sandbox.monnify.com";
        private String apiKey = "";
        private String secretKey = "";
        private String contractCode = "";
        private String webhookSecret = "";
        private String redirectUrl = "";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(15);

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    public static class Events {
        private String topic = "storefront-order-events";
    }
}
