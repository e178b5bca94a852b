package com.example.storefront.presentation.dto.response;

import com.example.storefront.domain.model.payment.Payment;
import com.example.storefront.domain.model.payment.PaymentStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentResponse {

    private String id;
    private String orderId;
    private String paymentReference;
    private String gatewayReference;
    private BigDecimal amount;
    private String currency;
    private PaymentStatus status;
    private String paymentMethod;
    private BigDecimal amountPaid;
    private AccountDetails accountDetails;
    private String checkoutUrl;
    private LocalDateTime paidAt;
    private LocalDateTime expiresAt;
    private LocalDateTime createdAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AccountDetails {
        private String accountNumber;
        private String accountName;
        private String bankName;
        private BigDecimal amount;
    }

    public static PaymentResponse from(Payment payment) {
        if (payment == null) {
            return null;
        }
        AccountDetails account = null;
        if (payment.getAccountNumber() != null && !payment.getAccountNumber().isBlank()) {
            account = AccountDetails.builder()
                    .accountNumber(payment.getAccountNumber())
                    .accountName(payment.getAccountName() != null ? payment.getAccountName() : "")
                    .bankName(payment.getBankName() != null ? payment.getBankName() : "")
                    .amount(payment.getAmount())
                    .build();
        }
        return PaymentResponse.builder()
                .id(payment.getId())
                .orderId(payment.getOrderId())
                .paymentReference(payment.getPaymentReference())
                .gatewayReference(payment.getGatewayReference())
                .amount(payment.getAmount())
                .currency(payment.getCurrency())
                .status(payment.getStatus())
                .paymentMethod(payment.getPaymentMethod())
                .amountPaid(payment.getAmountPaid())
                .accountDetails(account)
                .checkoutUrl(payment.getCheckoutUrl())
                .paidAt(payment.getPaidAt())
                .expiresAt(payment.getExpiresAt())
                .createdAt(payment.getCreatedAt())
                .build();
    }
}
