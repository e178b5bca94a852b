package com.example.storefront.application.service;

import com.example.storefront.domain.exception.OrderNumberExhaustedException;
import com.example.storefront.infrastructure.config.StorefrontProperties;
import com.example.storefront.infrastructure.util.IdGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.function.Function;

/**
 * Hands out order numbers until one is accepted.
 *
 * <p>{@code claim} tries to take a candidate (normally by inserting the order)
 * and returns empty if the number is already in use.
 */
@Slf4j
@Component
public class OrderNumberAllocator {

    private final int maxAttempts;
    private final Clock clock;

    @Autowired
    public OrderNumberAllocator(StorefrontProperties properties) {
        this(properties.getOrders().getOrderNumberMaxAttempts(), Clock.systemDefaultZone());
    }

    public OrderNumberAllocator(int maxAttempts, Clock clock) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.clock = clock;
    }

    public <T> T allocate(Function<String, Optional<T>> claim) {
        LocalDate today = LocalDate.now(clock);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = IdGenerator.generateOrderNumber(today);
            Optional<T> claimed = claim.apply(candidate);
            if (claimed.isPresent()) {
                if (attempt > 1) {
                    log.debug("Order number allocated after {} attempts: {}", attempt, candidate);
                }
                return claimed.get();
            }
            log.debug("Order number collision: candidate={}, attempt={}", candidate, attempt);
        }
        log.error("Order number allocation exhausted after {} attempts", maxAttempts);
        throw new OrderNumberExhaustedException(maxAttempts);
    }
}
