package com.example.storefront.application.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CustomerDetails {
    String name;
    String email;
    String phone;
    String deliveryAddress;
    String deliveryState;
    String deliveryLga;
}
