package com.example.storefront.presentation.dto.response;

import com.example.storefront.application.dto.OrderTracking;
import com.example.storefront.application.dto.TrackingEvent;
import com.example.storefront.domain.model.order.Order;
import com.example.storefront.domain.model.order.OrderLineItem;
import com.example.storefront.domain.model.order.OrderStatus;
import com.example.storefront.domain.model.payment.PaymentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Public tracking view; no delivery or contact details beyond the customer name
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackingResponse {

    private String orderNumber;
    private OrderStatus status;
    private PaymentStatus paymentStatus;
    private String customerName;
    private BigDecimal total;
    private LocalDateTime createdAt;
    private List<OrderLineItem> items;
    private List<TrackingEvent> trackingHistory;

    public static TrackingResponse from(OrderTracking tracking) {
        Order order = tracking.getOrder();
        return TrackingResponse.builder()
                .orderNumber(order.getOrderNumber())
                .status(order.getStatus())
                .paymentStatus(order.getPaymentStatus())
                .customerName(order.getCustomerName())
                .total(order.getTotal())
                .createdAt(order.getCreatedAt())
                .items(order.getItems())
                .trackingHistory(tracking.getEvents())
                .build();
    }
}
