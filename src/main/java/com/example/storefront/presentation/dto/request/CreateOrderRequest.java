package com.example.storefront.presentation.dto.request;

import com.example.storefront.application.dto.CheckoutCommand;
import com.example.storefront.application.dto.CheckoutLine;
import com.example.storefront.application.dto.CustomerDetails;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Public checkout request
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CreateOrderRequest {

    @NotBlank(message = "Store username is required")
    private String storeUsername;

    @NotBlank(message = "Customer name is required")
    @Size(max = 255)
    private String customerName;

    @Email(message = "Customer email is invalid")
    private String customerEmail;

    @NotBlank(message = "Customer phone is required")
    @Size(max = 20)
    private String customerPhone;

    @Size(max = 1000)
    private String deliveryAddress;

    @Size(max = 100)
    private String deliveryState;

    @Size(max = 100)
    private String deliveryLga;

    @NotEmpty(message = "At least one item is required")
    @Valid
    private List<OrderItemRequest> items;

    @PositiveOrZero(message = "Discount must not be negative")
    private BigDecimal discount;

    @PositiveOrZero(message = "Shipping fee must not be negative")
    private BigDecimal shippingFee;

    @Size(max = 2000)
    private String notes;

    public CheckoutCommand toCommand() {
        return CheckoutCommand.builder()
                .storeUsername(storeUsername)
                .customer(CustomerDetails.builder()
                        .name(customerName)
                        .email(customerEmail)
                        .phone(customerPhone)
                        .deliveryAddress(deliveryAddress)
                        .deliveryState(deliveryState)
                        .deliveryLga(deliveryLga)
                        .build())
                .lines(items.stream()
                        .map(i -> CheckoutLine.of(i.getProductId(), i.getQuantity(), i.getVariantSelection()))
                        .collect(Collectors.toList()))
                .discount(discount != null ? discount : BigDecimal.ZERO)
                .shippingFee(shippingFee != null ? shippingFee : BigDecimal.ZERO)
                .notes(notes)
                .build();
    }
}
