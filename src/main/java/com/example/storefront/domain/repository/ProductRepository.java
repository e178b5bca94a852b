package com.example.storefront.domain.repository;

import com.example.storefront.domain.model.catalog.Product;
import com.example.storefront.domain.model.common.RecordState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Product repository
 * - stock is never read-then-written; every change is one conditional UPDATE
 */
@Repository
public interface ProductRepository extends JpaRepository<Product, String> {

    Optional<Product> findByIdAndRecordState(String id, RecordState recordState);

    /**
     * Decrement stock only when enough is left and the product is purchasable.
     * Returns the affected row count (0 or 1).
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Product p SET p.stockQuantity = p.stockQuantity - :quantity, p.updatedAt = :now " +
            "WHERE p.id = :productId AND p.stockQuantity >= :quantity " +
            "AND p.active = true AND p.recordState = :state")
    int decrementStockIfAvailable(@Param("productId") String productId,
                                  @Param("quantity") int quantity,
                                  @Param("state") RecordState state,
                                  @Param("now") LocalDateTime now);

    /**
     * Return stock. Applies regardless of active flag or record state.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Product p SET p.stockQuantity = p.stockQuantity + :quantity, p.updatedAt = :now " +
            "WHERE p.id = :productId")
    int incrementStock(@Param("productId") String productId,
                       @Param("quantity") int quantity,
                       @Param("now") LocalDateTime now);
}
