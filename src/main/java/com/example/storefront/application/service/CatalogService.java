package com.example.storefront.application.service;

import com.example.storefront.domain.exception.InsufficientStockException;
import com.example.storefront.domain.exception.InvalidLineItemException;
import com.example.storefront.domain.exception.ProductNotFoundException;
import com.example.storefront.domain.exception.StoreNotFoundException;
import com.example.storefront.domain.model.catalog.Product;
import com.example.storefront.domain.model.common.RecordState;
import com.example.storefront.domain.model.store.Store;
import com.example.storefront.domain.repository.ProductRepository;
import com.example.storefront.domain.repository.StoreRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Store and product lookups plus atomic stock adjustment.
 *
 * <p>{@link #reserveStock} is a single conditional UPDATE; it never reads the
 * stock level before writing it. Each call commits on its own unless the caller
 * already holds a transaction.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CatalogService {

    private final StoreRepository storeRepository;
    private final ProductRepository productRepository;

    /**
     * Store open for public checkout
     *
     * @throws StoreNotFoundException if missing, inactive or deleted
     */
    @Transactional(readOnly = true)
    public Store findOpenStore(String username) {
        return storeRepository.findByUsername(username)
                .filter(Store::isOpen)
                .orElseThrow(() -> new StoreNotFoundException(username));
    }

    /**
     * Purchasable product belonging to the given store. A product of another
     * store is reported as not found.
     */
    @Transactional(readOnly = true)
    public Product findPurchasableProduct(String productId, String storeId) {
        return productRepository.findByIdAndRecordState(productId, RecordState.ACTIVE)
                .filter(p -> p.belongsTo(storeId))
                .filter(Product::isAvailable)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }

    @Transactional
    public void reserveStock(String productId, int quantity) {
        if (quantity <= 0) {
            throw new InvalidLineItemException("Quantity must be positive, got " + quantity);
        }

        int updated = productRepository.decrementStockIfAvailable(
                productId, quantity, RecordState.ACTIVE, LocalDateTime.now());
        if (updated == 1) {
            log.debug("Stock reserved: productId={}, quantity={}", productId, quantity);
            return;
        }

        // rejected; work out why for the caller
        Product product = productRepository.findByIdAndRecordState(productId, RecordState.ACTIVE)
                .filter(Product::isAvailable)
                .orElseThrow(() -> new ProductNotFoundException(productId));

        log.warn("Insufficient stock: productId={}, available={}, requested={}",
                productId, product.getStockQuantity(), quantity);
        throw new InsufficientStockException(productId, product.getName(), product.getStockQuantity(), quantity);
    }

    /**
     * Return stock. Never throws: a missing or deleted product is logged and skipped.
     */
    @Transactional
    public void releaseStock(String productId, int quantity) {
        if (quantity <= 0) {
            log.warn("Ignoring stock release with non-positive quantity: productId={}, quantity={}",
                    productId, quantity);
            return;
        }
        try {
            int updated = productRepository.incrementStock(productId, quantity, LocalDateTime.now());
            if (updated == 0) {
                log.warn("Stock release skipped, product no longer exists: productId={}, quantity={}",
                        productId, quantity);
            } else {
                log.debug("Stock released: productId={}, quantity={}", productId, quantity);
            }
        } catch (DataAccessException e) {
            log.error("Stock release failed: productId={}, quantity={}", productId, quantity, e);
        }
    }

    @Transactional(readOnly = true)
    public int getStock(String productId) {
        return productRepository.findById(productId)
                .map(Product::getStockQuantity)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }
}
