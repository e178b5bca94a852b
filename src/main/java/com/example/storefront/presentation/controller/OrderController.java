package com.example.storefront.presentation.controller;

import com.example.storefront.application.dto.CheckoutResult;
import com.example.storefront.application.dto.OrderListFilter;
import com.example.storefront.application.service.OrderService;
import com.example.storefront.domain.model.order.OrderStatus;
import com.example.storefront.domain.model.payment.PaymentStatus;
import com.example.storefront.presentation.dto.request.CreateOrderRequest;
import com.example.storefront.presentation.dto.request.UpdateOrderStatusRequest;
import com.example.storefront.presentation.dto.response.CreateOrderResponse;
import com.example.storefront.presentation.dto.response.OrderDetailsResponse;
import com.example.storefront.presentation.dto.response.OrderResponse;
import com.example.storefront.presentation.dto.response.PageResponse;
import com.example.storefront.presentation.dto.response.TrackingResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * Order endpoints
 * - checkout and tracking are public
 * - everything else is scoped to the store owner in {@code X-User-Id}
 */
@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
@Slf4j
@Validated
public class OrderController {

    static final String USER_HEADER = "X-User-Id";

    private final OrderService orderService;

    /**
     * POST /api/v1/orders
     */
    @PostMapping
    public ResponseEntity<CreateOrderResponse> createOrder(@Valid @RequestBody CreateOrderRequest request) {
        log.info("Order creation requested: store={}, items={}", request.getStoreUsername(), request.getItems().size());

        CheckoutResult result = orderService.createOrder(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(CreateOrderResponse.from(result));
    }

    /**
     * GET /api/v1/orders/track/{orderNumber}
     */
    @GetMapping("/track/{orderNumber}")
    public ResponseEntity<TrackingResponse> trackOrder(@PathVariable String orderNumber) {
        return ResponseEntity.ok(TrackingResponse.from(orderService.trackOrder(orderNumber)));
    }

    /**
     * GET /api/v1/orders
     * Filters: storeId, status, paymentStatus, search (order number, customer
     * name or email), dateFrom and dateTo (ISO dates, inclusive).
     */
    @GetMapping
    public ResponseEntity<PageResponse<OrderResponse>> listOrders(
            @RequestHeader(USER_HEADER) String userId,
            @RequestParam(required = false) String storeId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String paymentStatus,
            @RequestParam(required = false) @Size(max = 100) String search,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {

        OrderListFilter filter = OrderListFilter.builder()
                .storeId(storeId)
                .status(status != null ? OrderStatus.fromValue(status) : null)
                .paymentStatus(paymentStatus != null ? PaymentStatus.fromValue(paymentStatus) : null)
                .search(search)
                .dateFrom(dateFrom)
                .dateTo(dateTo)
                .build();

        return ResponseEntity.ok(PageResponse.from(
                orderService.listOrders(userId, filter, page, limit),
                OrderResponse::from));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderDetailsResponse> getOrder(@RequestHeader(USER_HEADER) String userId,
                                                         @PathVariable String orderId) {
        return ResponseEntity.ok(OrderDetailsResponse.from(orderService.getOrderDetails(orderId, userId)));
    }

    /**
     * PATCH /api/v1/orders/{orderId}/status
     */
    @PatchMapping("/{orderId}/status")
    public ResponseEntity<OrderDetailsResponse> updateStatus(@RequestHeader(USER_HEADER) String userId,
                                                             @PathVariable String orderId,
                                                             @Valid @RequestBody UpdateOrderStatusRequest request) {
        log.info("Order status change requested: orderId={}, status={}", orderId, request.getStatus());
        return ResponseEntity.ok(OrderDetailsResponse.from(
                orderService.updateStatus(orderId, userId, request.getStatus())));
    }

    /**
     * DELETE /api/v1/orders/{orderId}
     * Cancels the order; the row is kept.
     */
    @DeleteMapping("/{orderId}")
    public ResponseEntity<OrderDetailsResponse> cancelOrder(@RequestHeader(USER_HEADER) String userId,
                                                            @PathVariable String orderId) {
        log.info("Order cancellation requested: orderId={}", orderId);
        return ResponseEntity.ok(OrderDetailsResponse.from(orderService.cancelOrder(orderId, userId)));
    }
}
