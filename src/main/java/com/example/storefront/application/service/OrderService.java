package com.example.storefront.application.service;

import com.example.storefront.application.dto.ChannelProvisionRequest;
import com.example.storefront.application.dto.ChannelProvisionResult;
import com.example.storefront.application.dto.CheckoutCommand;
import com.example.storefront.application.dto.CheckoutLine;
import com.example.storefront.application.dto.CheckoutResult;
import com.example.storefront.application.dto.CustomerDetails;
import com.example.storefront.application.dto.OrderDetails;
import com.example.storefront.application.dto.OrderListFilter;
import com.example.storefront.application.dto.OrderTracking;
import com.example.storefront.application.dto.TrackingEvent;
import com.example.storefront.application.event.publisher.OrderEventPublisher;
import com.example.storefront.domain.exception.DomainException;
import com.example.storefront.domain.exception.ErrorKind;
import com.example.storefront.domain.exception.GatewayUnavailableException;
import com.example.storefront.domain.exception.InsufficientStockException;
import com.example.storefront.domain.exception.InvalidLineItemException;
import com.example.storefront.domain.exception.InvalidTransitionException;
import com.example.storefront.domain.exception.OrderAccessDeniedException;
import com.example.storefront.domain.exception.OrderException;
import com.example.storefront.domain.exception.OrderNotFoundException;
import com.example.storefront.domain.model.catalog.Product;
import com.example.storefront.domain.model.common.RecordState;
import com.example.storefront.domain.model.order.Order;
import com.example.storefront.domain.model.order.OrderLineItem;
import com.example.storefront.domain.model.order.OrderStatus;
import com.example.storefront.domain.model.payment.Payment;
import com.example.storefront.domain.model.payment.PaymentStatus;
import com.example.storefront.domain.model.store.Store;
import com.example.storefront.domain.repository.OrderRepository;
import com.example.storefront.domain.repository.PaymentRepository;
import com.example.storefront.domain.repository.StoreRepository;
import com.example.storefront.domain.service.PriceBreakdown;
import com.example.storefront.domain.service.PricedLine;
import com.example.storefront.domain.service.PricingEngine;
import com.example.storefront.infrastructure.config.StorefrontProperties;
import com.example.storefront.infrastructure.gateway.PaymentGatewayClient;
import com.example.storefront.infrastructure.monitoring.MonitoringService;
import com.example.storefront.infrastructure.util.IdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Order orchestration
 * - checkout: reserve stock, snapshot, price, provision payment channel, persist
 * - owner operations: details, listing, status changes, cancellation
 * - public tracking by order number
 *
 * Not transactional itself: every stock reservation commits on its own, and a
 * failure after any reservation is compensated explicitly.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrderService {

    public static final int MAX_PAGE_SIZE = 100;

    private final CatalogService catalogService;
    private final PricingEngine pricingEngine;
    private final OrderNumberAllocator orderNumberAllocator;
    private final OrderLedger orderLedger;
    private final OrderRepository orderRepository;
    private final PaymentRepository paymentRepository;
    private final StoreRepository storeRepository;
    private final PaymentGatewayClient paymentGatewayClient;
    private final OrderEventPublisher orderEventPublisher;
    private final MonitoringService monitoringService;
    private final StorefrontProperties properties;

    public CheckoutResult createOrder(CheckoutCommand command) {
        if (command.getLines() == null || command.getLines().isEmpty()) {
            throw new InvalidLineItemException("Order must contain at least one item");
        }

        Store store = catalogService.findOpenStore(command.getStoreUsername());
        log.info("Checkout started: store={}, lines={}", store.getUsername(), command.getLines().size());

        List<Reservation> reservations = new ArrayList<>();
        List<OrderLineItem> items = new ArrayList<>();
        try {
            for (CheckoutLine line : command.getLines()) {
                if (line.getQuantity() <= 0) {
                    throw new InvalidLineItemException("Quantity must be positive for product " + line.getProductId());
                }
                Product product = catalogService.findPurchasableProduct(line.getProductId(), store.getId());
                catalogService.reserveStock(product.getId(), line.getQuantity());
                reservations.add(new Reservation(product.getId(), line.getQuantity()));

                items.add(OrderLineItem.snapshot(product.getId(), product.getName(), product.getImageUrl(),
                        product.getPrice(), line.getQuantity(), line.getVariantSelection()));
            }
        } catch (InsufficientStockException e) {
            monitoringService.recordStockConflict(e.getProductId());
            compensate(reservations, e);
            throw e;
        } catch (RuntimeException e) {
            compensate(reservations, e);
            throw e;
        }

        try {
            return completeCheckout(command, store, items);
        } catch (RuntimeException e) {
            compensate(reservations, e);
            if (e instanceof DomainException) {
                throw e;
            }
            log.error("Order persistence failed after stock reservation: store={}", store.getUsername(), e);
            throw new OrderException(ErrorKind.INTERNAL, "ORDER_CREATION_FAILED", "Failed to create order", e);
        }
    }

    private CheckoutResult completeCheckout(CheckoutCommand command, Store store, List<OrderLineItem> items) {
        PriceBreakdown price = pricingEngine.computeTotals(
                items.stream()
                        .map(i -> PricedLine.of(i.getUnitPrice(), i.getQuantity()))
                        .collect(Collectors.toList()),
                command.getDiscount(), command.getShippingFee());

        String orderId = IdGenerator.generateEntityId();
        String paymentReference = IdGenerator.generatePaymentReference(orderId);
        CustomerDetails customer = command.getCustomer();

        Order order = Order.builder()
                .id(orderId)
                .storeId(store.getId())
                .customerName(customer.getName())
                .customerEmail(customer.getEmail())
                .customerPhone(customer.getPhone())
                .deliveryAddress(customer.getDeliveryAddress())
                .deliveryState(customer.getDeliveryState())
                .deliveryLga(customer.getDeliveryLga())
                .items(Collections.unmodifiableList(items))
                .subtotal(price.getSubtotal())
                .discount(price.getDiscount())
                .shippingFee(price.getShippingFee())
                .platformFee(price.getPlatformFee())
                .total(price.getTotal())
                .status(OrderStatus.PENDING)
                .paymentStatus(PaymentStatus.PENDING)
                .notes(command.getNotes())
                .build();

        Payment payment = Payment.builder()
                .id(IdGenerator.generateEntityId())
                .orderId(orderId)
                .amount(price.getTotal())
                .currency(properties.getCurrency())
                .status(PaymentStatus.PENDING)
                .paymentReference(paymentReference)
                .build();

        // the order survives a gateway failure; the channel can be provisioned later
        boolean paymentInitialized;
        try {
            ChannelProvisionResult channel = paymentGatewayClient.provisionChannel(ChannelProvisionRequest.builder()
                    .amount(price.getTotal())
                    .currency(properties.getCurrency())
                    .paymentReference(paymentReference)
                    .payerName(customer.getName())
                    .payerEmail(customer.getEmail())
                    .description("Payment for order " + orderId)
                    .build());
            applyChannel(payment, channel);
            paymentInitialized = true;
        } catch (GatewayUnavailableException e) {
            log.warn("Payment initialization failed, order kept pending: orderId={}, ref={}, error={}",
                    orderId, paymentReference, e.getMessage());
            paymentInitialized = false;
        }

        OrderDetails saved = orderNumberAllocator.allocate(candidate -> {
            order.setOrderNumber(candidate);
            try {
                return Optional.of(orderLedger.record(order, payment));
            } catch (DataIntegrityViolationException e) {
                if (orderLedger.isOrderNumberTaken(candidate)) {
                    return Optional.empty();
                }
                throw e;
            }
        });

        monitoringService.recordOrderCreated();
        log.info("Order created: orderId={}, orderNumber={}, total={}, ref={}, paymentInitialized={}",
                orderId, saved.getOrder().getOrderNumber(), price.getTotal(), paymentReference, paymentInitialized);

        orderEventPublisher.publishOrderCreated(saved.getOrder(), paymentReference);

        return CheckoutResult.builder()
                .order(saved.getOrder())
                .payment(saved.getPayment())
                .paymentInitialized(paymentInitialized)
                .message(paymentInitialized
                        ? "Order created successfully"
                        : "Order created but payment initialization failed. Please retry payment.")
                .build();
    }

    private void applyChannel(Payment payment, ChannelProvisionResult channel) {
        payment.setGatewayReference(channel.getGatewayReference());
        payment.setAccountNumber(channel.getAccountNumber());
        payment.setAccountName(channel.getAccountName());
        payment.setBankName(channel.getBankName());
        payment.setCheckoutUrl(channel.getCheckoutUrl());
        payment.setExpiresAt(channel.getExpiresAt());
    }

    /**
     * Best-effort release of reservations made before a failure. Never masks
     * the original error.
     */
    private void compensate(List<Reservation> reservations, RuntimeException cause) {
        if (reservations.isEmpty()) {
            return;
        }
        log.warn("Releasing {} reservation(s) after checkout failure: {}", reservations.size(), cause.getMessage());
        for (Reservation reservation : reservations) {
            try {
                catalogService.releaseStock(reservation.getProductId(), reservation.getQuantity());
            } catch (RuntimeException e) {
                log.error("Compensation failed: productId={}, quantity={}",
                        reservation.getProductId(), reservation.getQuantity(), e);
            }
        }
    }

    @Transactional(readOnly = true)
    public OrderDetails getOrderDetails(String orderId, String requesterUserId) {
        Order order = findOwnedOrder(orderId, requesterUserId);
        Payment payment = paymentRepository.findByOrderId(order.getId()).orElse(null);
        return OrderDetails.of(order, payment);
    }

    @Transactional(readOnly = true)
    public Page<Order> listOrders(String requesterUserId, OrderListFilter filter, int page, int limit) {
        int size = Math.min(Math.max(limit, 1), MAX_PAGE_SIZE);
        Pageable pageable = PageRequest.of(Math.max(page, 1) - 1, size, Sort.by(Sort.Direction.DESC, "createdAt"));
        OrderListFilter f = filter != null ? filter : OrderListFilter.none();

        return orderRepository.findOwnedOrders(requesterUserId, RecordState.ACTIVE,
                f.getStoreId(), f.getStatus(), f.getPaymentStatus(),
                searchPattern(f.getSearch()),
                f.getDateFrom() != null ? f.getDateFrom().atStartOfDay() : null,
                f.getDateTo() != null ? f.getDateTo().plusDays(1).atStartOfDay() : null,
                pageable);
    }

    private static String searchPattern(String search) {
        if (search == null || search.isBlank()) {
            return null;
        }
        String escaped = search.trim().toLowerCase(Locale.ROOT)
                .replace("!", "!!")
                .replace("%", "!%")
                .replace("_", "!_");
        return "%" + escaped + "%";
    }

    /**
     * Owner-driven fulfilment step. A request to cancel goes through
     * {@link #cancelOrder} so reserved stock comes back.
     */
    public OrderDetails updateStatus(String orderId, String requesterUserId, OrderStatus requested) {
        Order order = findOwnedOrder(orderId, requesterUserId);
        if (requested == OrderStatus.CANCELLED) {
            return cancelOrder(orderId, requesterUserId);
        }

        OrderStatus current = order.getStatus();
        if (!current.canTransitionTo(requested)) {
            log.warn("Rejected status change: orderId={}, from={}, to={}", orderId, current, requested);
            throw new InvalidTransitionException(current, requested);
        }

        orderLedger.transition(orderId, current, requested);
        log.info("Order status updated: orderId={}, {} -> {}", orderId, current, requested);
        orderEventPublisher.publishOrderStatusChanged(orderId, current, requested);

        return reload(orderId);
    }

    public OrderDetails cancelOrder(String orderId, String requesterUserId) {
        Order order = findOwnedOrder(orderId, requesterUserId);
        if (!order.isCancellable()) {
            log.warn("Rejected cancellation: orderId={}, status={}", orderId, order.getStatus());
            throw new InvalidTransitionException("Order cannot be cancelled", order.getStatus());
        }

        orderLedger.cancel(order);
        orderEventPublisher.publishOrderCancelled(orderId, order.getStatus());

        return reload(orderId);
    }

    /**
     * Public tracking. History is derived: creation, then every fulfilment step
     * up to the current one (a cancelled order shows creation then cancellation).
     */
    @Transactional(readOnly = true)
    public OrderTracking trackOrder(String orderNumber) {
        Order order = orderRepository.findByOrderNumberAndRecordState(orderNumber, RecordState.ACTIVE)
                .orElseThrow(() -> new OrderNotFoundException(orderNumber));

        List<TrackingEvent> events = new ArrayList<>();
        events.add(TrackingEvent.of(OrderStatus.PENDING, order.getCreatedAt()));

        OrderStatus current = order.getStatus();
        if (current == OrderStatus.CANCELLED) {
            events.add(TrackingEvent.of(OrderStatus.CANCELLED, order.getUpdatedAt()));
        } else {
            int currentIndex = OrderStatus.PROGRESSION.indexOf(current);
            for (int i = 1; i <= currentIndex; i++) {
                OrderStatus step = OrderStatus.PROGRESSION.get(i);
                events.add(TrackingEvent.of(step, step == current ? order.getUpdatedAt() : null));
            }
        }
        return OrderTracking.of(order, events);
    }

    private Order findOwnedOrder(String orderId, String requesterUserId) {
        Order order = orderRepository.findByIdAndRecordState(orderId, RecordState.ACTIVE)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        boolean owned = storeRepository.findById(order.getStoreId())
                .map(store -> store.isOwnedBy(requesterUserId))
                .orElse(false);
        if (!owned) {
            log.warn("Order access denied: orderId={}, userId={}", orderId, requesterUserId);
            throw new OrderAccessDeniedException();
        }
        return order;
    }

    private OrderDetails reload(String orderId) {
        Order order = orderRepository.findByIdAndRecordState(orderId, RecordState.ACTIVE)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        return OrderDetails.of(order, paymentRepository.findByOrderId(orderId).orElse(null));
    }

    @Value
    private static class Reservation {
        String productId;
        int quantity;
    }
}
