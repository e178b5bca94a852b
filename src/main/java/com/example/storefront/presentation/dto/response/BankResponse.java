package com.example.storefront.presentation.dto.response;

import com.example.storefront.application.dto.BankInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BankResponse {

    private String name;
    private String code;

    public static BankResponse from(BankInfo bank) {
        return new BankResponse(bank.getName(), bank.getCode());
    }
}
