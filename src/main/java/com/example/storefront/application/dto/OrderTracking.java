package com.example.storefront.application.dto;

import com.example.storefront.domain.model.order.Order;
import lombok.Value;

import java.util.List;

@Value(staticConstructor = "of")
public class OrderTracking {
    Order order;
    List<TrackingEvent> events;
}
