package com.example.storefront.application.service;

import com.example.storefront.application.event.publisher.OrderEventPublisher;
import com.example.storefront.domain.exception.InsufficientStockException;
import com.example.storefront.domain.exception.InvalidLineItemException;
import com.example.storefront.domain.exception.ProductNotFoundException;
import com.example.storefront.domain.exception.StoreNotFoundException;
import com.example.storefront.domain.model.catalog.Product;
import com.example.storefront.domain.model.store.Store;
import com.example.storefront.domain.repository.ProductRepository;
import com.example.storefront.domain.repository.StoreRepository;
import com.example.storefront.support.StorefrontFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class CatalogServiceIntegrationTest {

    @Autowired
    private CatalogService catalogService;

    @Autowired
    private StoreRepository storeRepository;

    @Autowired
    private ProductRepository productRepository;

    @MockBean
    private OrderEventPublisher orderEventPublisher;

    private StorefrontFixtures fixtures;
    private Store store;

    @BeforeEach
    void setUp() {
        fixtures = new StorefrontFixtures(storeRepository, productRepository);
        store = fixtures.store("catalog");
    }

    @Test
    @DisplayName("20 concurrent buyers of 3 units each never oversell a stock of 10")
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void concurrentReservationsNeverOversell() throws InterruptedException {
        int initialStock = 10;
        int quantity = 3;
        int buyers = 20;
        Product product = fixtures.product(store, "Aso Oke", "5000.00", initialStock);

        ExecutorService executor = Executors.newFixedThreadPool(buyers);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch completeLatch = new CountDownLatch(buyers);
        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger rejectedCount = new AtomicInteger();
        List<Throwable> unexpected = new CopyOnWriteArrayList<>();

        for (int i = 0; i < buyers; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    catalogService.reserveStock(product.getId(), quantity);
                    successCount.incrementAndGet();
                } catch (InsufficientStockException e) {
                    rejectedCount.incrementAndGet();
                } catch (Throwable t) {
                    unexpected.add(t);
                } finally {
                    completeLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(completeLatch.await(50, TimeUnit.SECONDS));
        executor.shutdown();

        int finalStock = catalogService.getStock(product.getId());

        assertTrue(unexpected.isEmpty(), () -> "unexpected failures: " + unexpected);
        assertEquals(buyers, successCount.get() + rejectedCount.get());
        assertTrue(successCount.get() <= initialStock / quantity);
        assertEquals(initialStock - successCount.get() * quantity, finalStock);
        assertTrue(finalStock >= 0);
    }

    @Test
    void rejectionReportsAvailableAndRequested() {
        Product product = fixtures.product(store, "Gele", "1500.00", 2);

        InsufficientStockException ex = assertThrows(InsufficientStockException.class,
                () -> catalogService.reserveStock(product.getId(), 3));

        assertEquals(product.getId(), ex.getProductId());
        assertEquals(2, ex.getAvailable());
        assertEquals(3, ex.getRequested());
        assertEquals(2, catalogService.getStock(product.getId()));
    }

    @Test
    void reservationDownToZeroIsAllowed() {
        Product product = fixtures.product(store, "Beads", "300.00", 4);

        catalogService.reserveStock(product.getId(), 4);

        assertEquals(0, catalogService.getStock(product.getId()));
        assertThrows(InsufficientStockException.class, () -> catalogService.reserveStock(product.getId(), 1));
    }

    @Test
    void nonPositiveQuantityIsRejected() {
        Product product = fixtures.product(store, "Fan", "800.00", 4);

        assertThrows(InvalidLineItemException.class, () -> catalogService.reserveStock(product.getId(), 0));
        assertThrows(InvalidLineItemException.class, () -> catalogService.reserveStock(product.getId(), -2));
        assertEquals(4, catalogService.getStock(product.getId()));
    }

    @Test
    void deletedProductCannotBeReservedButReleaseDoesNotThrow() {
        Product product = fixtures.softDelete(fixtures.product(store, "Cap", "700.00", 5));

        assertThrows(ProductNotFoundException.class, () -> catalogService.reserveStock(product.getId(), 1));
        assertDoesNotThrow(() -> catalogService.releaseStock(product.getId(), 1));
        assertDoesNotThrow(() -> catalogService.releaseStock("missing-product", 1));
    }

    @Test
    void releaseReturnsUnits() {
        Product product = fixtures.product(store, "Wrapper", "2500.00", 5);

        catalogService.reserveStock(product.getId(), 3);
        catalogService.releaseStock(product.getId(), 3);

        assertEquals(5, catalogService.getStock(product.getId()));
    }

    @Test
    void productOfAnotherStoreIsNotPurchasable() {
        Store other = fixtures.store("other");
        Product product = fixtures.product(other, "Sandals", "4000.00", 5);

        assertThrows(ProductNotFoundException.class,
                () -> catalogService.findPurchasableProduct(product.getId(), store.getId()));
        assertEquals(product.getId(),
                catalogService.findPurchasableProduct(product.getId(), other.getId()).getId());
    }

    @Test
    void inactiveStoreIsNotOpen() {
        Store closed = fixtures.store("closed");
        closed.setActive(false);
        storeRepository.save(closed);

        assertThrows(StoreNotFoundException.class, () -> catalogService.findOpenStore(closed.getUsername()));
        assertThrows(StoreNotFoundException.class, () -> catalogService.findOpenStore("no-such-store"));
    }

    @Test
    @DisplayName("the products table refuses a non-positive price")
    void nonPositivePriceIsRejectedByTheDatabase() {
        assertThrows(DataIntegrityViolationException.class, () -> fixtures.product(store, "Freebie", "0.00", 5));
        assertThrows(DataIntegrityViolationException.class, () -> fixtures.product(store, "Refund", "-10.00", 5));
    }
}
