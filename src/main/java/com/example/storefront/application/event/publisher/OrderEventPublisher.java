package com.example.storefront.application.event.publisher;

import com.example.storefront.domain.model.order.Order;
import com.example.storefront.domain.model.order.OrderStatus;
import com.example.storefront.domain.model.payment.PaymentStatus;
import com.example.storefront.infrastructure.config.AsyncConfig;
import com.example.storefront.infrastructure.config.StorefrontProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Order / payment event publisher
 * - consumed by the notification service (email, SMS)
 * - fire-and-forget: failures are logged and never reach the caller
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrderEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final StorefrontProperties properties;

    @Async(AsyncConfig.EVENT_EXECUTOR)
    public void publishOrderCreated(Order order, String paymentReference) {
        Map<String, Object> data = new HashMap<>();
        data.put("orderNumber", order.getOrderNumber());
        data.put("storeId", order.getStoreId());
        data.put("customerName", order.getCustomerName());
        data.put("customerEmail", order.getCustomerEmail());
        data.put("customerPhone", order.getCustomerPhone());
        data.put("total", order.getTotal());
        data.put("paymentReference", paymentReference);
        publishEvent("ORDER_CREATED", order.getId(), data);
    }

    @Async(AsyncConfig.EVENT_EXECUTOR)
    public void publishOrderStatusChanged(String orderId, OrderStatus oldStatus, OrderStatus newStatus) {
        publishEvent("ORDER_STATUS_CHANGED", orderId, Map.of(
                "oldStatus", oldStatus.getValue(),
                "newStatus", newStatus.getValue()
        ));
    }

    @Async(AsyncConfig.EVENT_EXECUTOR)
    public void publishOrderCancelled(String orderId, OrderStatus previousStatus) {
        publishEvent("ORDER_CANCELLED", orderId, Map.of(
                "previousStatus", previousStatus.getValue()
        ));
    }

    @Async(AsyncConfig.EVENT_EXECUTOR)
    public void publishPaymentStatusChanged(String orderId, String paymentReference,
                                            PaymentStatus oldStatus, PaymentStatus newStatus) {
        publishEvent("PAYMENT_STATUS_CHANGED", orderId, Map.of(
                "paymentReference", paymentReference,
                "oldStatus", oldStatus.getValue(),
                "newStatus", newStatus.getValue()
        ));
    }

    private void publishEvent(String eventType, String orderId, Map<String, Object> additionalData) {
        try {
            Map<String, Object> eventData = new HashMap<>(additionalData);
            eventData.put("eventType", eventType);
            eventData.put("orderId", orderId);
            eventData.put("timestamp", System.currentTimeMillis());

            String eventJson = objectMapper.writeValueAsString(eventData);

            kafkaTemplate.send(properties.getEvents().getTopic(), orderId, eventJson)
                    .whenComplete((result, ex) -> {
                        if (ex == null) {
                            log.debug("Order event published: type={}, orderId={}", eventType, orderId);
                        } else {
                            log.error("Failed to publish order event: type={}, orderId={}, error={}",
                                    eventType, orderId, ex.getMessage());
                        }
                    });

        } catch (Exception e) {
            log.error("Error publishing order event: type={}, orderId={}", eventType, orderId, e);
        }
    }
}
