package com.example.storefront.presentation.dto.response;

import com.example.storefront.application.dto.OrderDetails;
import com.example.storefront.domain.model.order.OrderLineItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderDetailsResponse {

    private OrderResponse order;
    private List<OrderLineItem> items;
    private PaymentResponse payment;

    public static OrderDetailsResponse from(OrderDetails details) {
        return OrderDetailsResponse.builder()
                .order(OrderResponse.from(details.getOrder()))
                .items(details.getOrder().getItems())
                .payment(PaymentResponse.from(details.getPayment()))
                .build();
    }
}
