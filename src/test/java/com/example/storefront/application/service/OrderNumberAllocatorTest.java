package com.example.storefront.application.service;

import com.example.storefront.domain.exception.OrderNumberExhaustedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrderNumberAllocatorTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-08-15T10:00:00Z"), ZoneOffset.UTC);
    private static final Pattern FORMAT = Pattern.compile("ORD-20240815-\\d{5}");

    @Test
    void generatesNumbersInTheDocumentedFormat() {
        OrderNumberAllocator allocator = new OrderNumberAllocator(10, FIXED);

        String number = allocator.allocate(Optional::of);

        assertTrue(FORMAT.matcher(number).matches(), number);
    }

    @Test
    @DisplayName("10,000 concurrent allocations yield no duplicates")
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void concurrentAllocationsAreUnique() throws InterruptedException {
        OrderNumberAllocator allocator = new OrderNumberAllocator(10, FIXED);
        Set<String> taken = ConcurrentHashMap.newKeySet();
        List<String> allocated = new CopyOnWriteArrayList<>();
        AtomicInteger collisions = new AtomicInteger();
        List<Throwable> failures = new CopyOnWriteArrayList<>();

        int total = 10_000;
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(total);

        for (int i = 0; i < total; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    allocated.add(allocator.allocate(candidate -> {
                        if (taken.add(candidate)) {
                            return Optional.of(candidate);
                        }
                        collisions.incrementAndGet();
                        return Optional.empty();
                    }));
                } catch (Throwable t) {
                    failures.add(t);
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(50, TimeUnit.SECONDS));
        executor.shutdown();

        assertTrue(failures.isEmpty(), () -> "allocation failures: " + failures);
        assertEquals(total, allocated.size());
        assertEquals(total, Set.copyOf(allocated).size());
        // 10,000 draws from 90,000 values collide with near certainty
        assertTrue(collisions.get() > 0, "retry path not exercised");
    }

    @Test
    void givesUpAfterMaxAttempts() {
        OrderNumberAllocator allocator = new OrderNumberAllocator(3, FIXED);
        AtomicInteger attempts = new AtomicInteger();

        OrderNumberExhaustedException ex = assertThrows(OrderNumberExhaustedException.class,
                () -> allocator.allocate(candidate -> {
                    attempts.incrementAndGet();
                    return Optional.empty();
                }));

        assertEquals(3, attempts.get());
        assertEquals(3, ex.getDetails().get("attempts"));
    }

    @Test
    void rejectsNonPositiveMaxAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new OrderNumberAllocator(0, FIXED));
    }
}
