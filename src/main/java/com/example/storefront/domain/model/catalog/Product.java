package com.example.storefront.domain.model.catalog;

import com.example.storefront.domain.model.common.BaseEntity;
import com.example.storefront.domain.model.common.RecordState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Check;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Product entity
 * - stock is only changed through the conditional updates in ProductRepository
 */
@Entity
@Table(name = "products", indexes = {
        @Index(name = "idx_product_store", columnList = "store_id")
})
@Check(constraints = "stock_quantity >= 0 AND price > 0")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product extends BaseEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "store_id", nullable = false, length = 36)
    private String storeId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "stock_quantity", nullable = false)
    private int stockQuantity;

    @Column(name = "image_url", length = 500)
    private String imageUrl;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_state", nullable = false, length = 10)
    @Builder.Default
    private RecordState recordState = RecordState.ACTIVE;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    /**
     * Purchasable: active and not soft-deleted
     */
    public boolean isAvailable() {
        return active && !recordState.isDeleted();
    }

    public boolean belongsTo(String storeId) {
        return this.storeId != null && this.storeId.equals(storeId);
    }
}
