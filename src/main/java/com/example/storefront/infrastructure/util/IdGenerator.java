package com.example.storefront.infrastructure.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Identifier generation for orders and payments
 */
public final class IdGenerator {

    private static final DateTimeFormatter ORDER_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private IdGenerator() {
    }

    /**
     * Primary key for entities (UUID string)
     */
    public static String generateEntityId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Human readable order number
     * format: ORD-{yyyyMMdd}-{NNNNN}
     * e.g. ORD-20240815-48213
     *
     * Not unique by construction; callers must retry on collision.
     */
    public static String generateOrderNumber(LocalDate date) {
        int suffix = ThreadLocalRandom.current().nextInt(10000, 100000);
        return "ORD-" + date.format(ORDER_DATE) + "-" + suffix;
    }

    /**
     * Payment reference, the idempotency key for a payment
     * format: PAY-{first 8 chars of order id}-{8 random hex}
     */
    public static String generatePaymentReference(String orderId) {
        String prefix = orderId.length() > 8 ? orderId.substring(0, 8) : orderId;
        return "PAY-" + prefix + "-" + generateRandomHex(8);
    }

    private static String generateRandomHex(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(Integer.toHexString(ThreadLocalRandom.current().nextInt(16)));
        }
        return sb.toString();
    }
}
