package com.example.storefront.presentation.dto.response;

import com.example.storefront.application.dto.CheckoutResult;
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
public class CreateOrderResponse {

    private String message;
    private boolean paymentInitialized;
    private OrderResponse order;
    private List<OrderLineItem> items;
    private PaymentResponse payment;

    public static CreateOrderResponse from(CheckoutResult result) {
        return CreateOrderResponse.builder()
                .message(result.getMessage())
                .paymentInitialized(result.isPaymentInitialized())
                .order(OrderResponse.from(result.getOrder()))
                .items(result.getOrder().getItems())
                .payment(PaymentResponse.from(result.getPayment()))
                .build();
    }
}
