package com.example.storefront.domain.repository;

import com.example.storefront.domain.model.common.RecordState;
import com.example.storefront.domain.model.order.Order;
import com.example.storefront.domain.model.order.OrderStatus;
import com.example.storefront.domain.model.payment.PaymentStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

/**
 * Order repository
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, String> {

    Optional<Order> findByIdAndRecordState(String id, RecordState recordState);

    Optional<Order> findByOrderNumberAndRecordState(String orderNumber, RecordState recordState);

    boolean existsByOrderNumber(String orderNumber);

    /**
     * Orders across every live store the user owns, newest first.
     * {@code search} is an already lower-cased LIKE pattern escaped with {@code !};
     * {@code createdBefore} is exclusive.
     */
    @Query("SELECT o FROM StoreOrder o WHERE o.recordState = :state " +
            "AND o.storeId IN (SELECT s.id FROM Store s WHERE s.userId = :userId AND s.recordState = :state) " +
            "AND (:storeId IS NULL OR o.storeId = :storeId) " +
            "AND (:status IS NULL OR o.status = :status) " +
            "AND (:paymentStatus IS NULL OR o.paymentStatus = :paymentStatus) " +
            "AND (:search IS NULL OR LOWER(o.orderNumber) LIKE :search ESCAPE '!' " +
            "     OR LOWER(o.customerName) LIKE :search ESCAPE '!' " +
            "     OR LOWER(o.customerEmail) LIKE :search ESCAPE '!') " +
            "AND (:createdFrom IS NULL OR o.createdAt >= :createdFrom) " +
            "AND (:createdBefore IS NULL OR o.createdAt < :createdBefore)")
    Page<Order> findOwnedOrders(@Param("userId") String userId,
                                @Param("state") RecordState state,
                                @Param("storeId") String storeId,
                                @Param("status") OrderStatus status,
                                @Param("paymentStatus") PaymentStatus paymentStatus,
                                @Param("search") String search,
                                @Param("createdFrom") LocalDateTime createdFrom,
                                @Param("createdBefore") LocalDateTime createdBefore,
                                Pageable pageable);

    /**
     * Compare-and-set on the fulfilment status
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE StoreOrder o SET o.status = :next, o.updatedAt = :now " +
            "WHERE o.id = :orderId AND o.status IN :expected")
    int transitionStatus(@Param("orderId") String orderId,
                         @Param("expected") Collection<OrderStatus> expected,
                         @Param("next") OrderStatus next,
                         @Param("now") LocalDateTime now);

    /**
     * Mirrors the payment record's status onto the order
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE StoreOrder o SET o.paymentStatus = :paymentStatus, o.updatedAt = :now WHERE o.id = :orderId")
    int updatePaymentStatus(@Param("orderId") String orderId,
                            @Param("paymentStatus") PaymentStatus paymentStatus,
                            @Param("now") LocalDateTime now);
}
