package com.example.storefront.application.service;

import com.example.storefront.application.dto.OrderDetails;
import com.example.storefront.domain.exception.InvalidTransitionException;
import com.example.storefront.domain.exception.OrderNotFoundException;
import com.example.storefront.domain.model.common.RecordState;
import com.example.storefront.domain.model.order.Order;
import com.example.storefront.domain.model.order.OrderLineItem;
import com.example.storefront.domain.model.order.OrderStatus;
import com.example.storefront.domain.model.payment.Payment;
import com.example.storefront.domain.repository.OrderRepository;
import com.example.storefront.domain.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Transactional writes for orders. Kept apart from {@link OrderService} so that
 * the orchestration (stock reservation, gateway call) runs outside any
 * database transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderLedger {

    private static final Set<OrderStatus> CANCELLABLE = EnumSet.of(OrderStatus.PENDING, OrderStatus.CONFIRMED);

    private final OrderRepository orderRepository;
    private final PaymentRepository paymentRepository;
    private final CatalogService catalogService;

    /**
     * Insert order and payment together. A duplicate order number surfaces as
     * {@link org.springframework.dao.DataIntegrityViolationException} with
     * nothing written.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OrderDetails record(Order order, Payment payment) {
        Order savedOrder = orderRepository.saveAndFlush(order);
        Payment savedPayment = paymentRepository.saveAndFlush(payment);
        return OrderDetails.of(savedOrder, savedPayment);
    }

    @Transactional(readOnly = true)
    public boolean isOrderNumberTaken(String orderNumber) {
        return orderRepository.existsByOrderNumber(orderNumber);
    }

    /**
     * Compare-and-set status change
     *
     * @throws InvalidTransitionException if the order moved on concurrently
     */
    @Transactional
    public void transition(String orderId, OrderStatus expected, OrderStatus next) {
        int updated = orderRepository.transitionStatus(orderId, EnumSet.of(expected), next, LocalDateTime.now());
        if (updated == 0) {
            OrderStatus current = currentStatus(orderId);
            log.warn("Order status changed concurrently: orderId={}, expected={}, actual={}, requested={}",
                    orderId, expected, current, next);
            throw new InvalidTransitionException(current, next);
        }
    }

    /**
     * Mark the order cancelled and return every reserved unit, in one transaction.
     * The conditional update guarantees stock is released at most once.
     */
    @Transactional
    public void cancel(Order order) {
        int updated = orderRepository.transitionStatus(
                order.getId(), CANCELLABLE, OrderStatus.CANCELLED, LocalDateTime.now());
        if (updated == 0) {
            OrderStatus current = currentStatus(order.getId());
            throw new InvalidTransitionException("Order cannot be cancelled", current);
        }

        for (OrderLineItem item : order.getItems()) {
            catalogService.releaseStock(item.getProductId(), item.getQuantity());
        }
        log.info("Order cancelled: orderId={}, releasedLines={}", order.getId(), order.getItems().size());
    }

    private OrderStatus currentStatus(String orderId) {
        return orderRepository.findByIdAndRecordState(orderId, RecordState.ACTIVE)
                .map(Order::getStatus)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }
}
