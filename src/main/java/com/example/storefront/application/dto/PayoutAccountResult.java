package com.example.storefront.application.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class PayoutAccountResult {
    String accountNumber;
    String accountName;
    String bankCode;
    String bankName;
}
