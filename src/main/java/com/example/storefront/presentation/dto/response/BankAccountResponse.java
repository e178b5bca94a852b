package com.example.storefront.presentation.dto.response;

import com.example.storefront.application.dto.PayoutAccountResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BankAccountResponse {

    private String accountNumber;
    private String accountName;
    private String bankCode;
    private String bankName;

    public static BankAccountResponse from(PayoutAccountResult result) {
        return BankAccountResponse.builder()
                .accountNumber(result.getAccountNumber())
                .accountName(result.getAccountName())
                .bankCode(result.getBankCode())
                .bankName(result.getBankName())
                .build();
    }
}
