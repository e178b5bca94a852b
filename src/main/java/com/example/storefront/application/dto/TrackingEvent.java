package com.example.storefront.application.dto;

import com.example.storefront.domain.model.order.OrderStatus;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One step of the derived tracking history; {@code timestamp} is only known
 * for creation and for the current status.
 */
@Value(staticConstructor = "of")
public class TrackingEvent {
    OrderStatus status;
    LocalDateTime timestamp;
}
