package com.example.storefront.domain.model.order;

import com.example.storefront.domain.model.common.BaseEntity;
import com.example.storefront.domain.model.common.RecordState;
import com.example.storefront.domain.model.payment.PaymentStatus;
import com.example.storefront.infrastructure.persistence.converter.OrderLineItemsConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Order entity
 * - line items are an immutable snapshot stored alongside the order
 * - {@code status} (fulfilment) and {@code paymentStatus} are independent;
 *   reconciliation only ever writes {@code paymentStatus}
 */
@Entity(name = "StoreOrder")
@Table(name = "orders", indexes = {
        @Index(name = "idx_order_store", columnList = "store_id"),
        @Index(name = "idx_order_status", columnList = "status"),
        @Index(name = "idx_order_payment_status", columnList = "payment_status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order extends BaseEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "store_id", nullable = false, length = 36)
    private String storeId;

    @Column(name = "order_number", nullable = false, unique = true, length = 50)
    private String orderNumber;

    @Column(name = "customer_name", nullable = false)
    private String customerName;

    @Column(name = "customer_email")
    private String customerEmail;

    @Column(name = "customer_phone", nullable = false, length = 20)
    private String customerPhone;

    @Column(name = "delivery_address", length = 1000)
    private String deliveryAddress;

    @Column(name = "delivery_state", length = 100)
    private String deliveryState;

    @Column(name = "delivery_lga", length = 100)
    private String deliveryLga;

    @Lob
    @Convert(converter = OrderLineItemsConverter.class)
    @Column(name = "items", nullable = false)
    private List<OrderLineItem> items;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal subtotal;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal discount;

    @Column(name = "shipping_fee", nullable = false, precision = 12, scale = 2)
    private BigDecimal shippingFee;

    @Column(name = "platform_fee", nullable = false, precision = 12, scale = 2)
    private BigDecimal platformFee;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal total;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(length = 2000)
    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_state", nullable = false, length = 10)
    @Builder.Default
    private RecordState recordState = RecordState.ACTIVE;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    public boolean isCancellable() {
        return status != null && status.isCancellable();
    }

    public boolean isPaid() {
        return paymentStatus == PaymentStatus.PAID;
    }

    public boolean isDeleted() {
        return recordState != null && recordState.isDeleted();
    }

    /**
     * Re-derives the total from the stored snapshot and fee fields
     */
    public BigDecimal recomputeTotal() {
        BigDecimal itemsTotal = items.stream()
                .map(OrderLineItem::getSubtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return itemsTotal.subtract(discount).add(shippingFee).add(platformFee);
    }
}
