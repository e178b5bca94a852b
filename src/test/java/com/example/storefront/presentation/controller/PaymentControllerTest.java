package com.example.storefront.presentation.controller;

import com.example.storefront.application.dto.BankInfo;
import com.example.storefront.application.dto.PayoutAccountResult;
import com.example.storefront.application.service.PaymentService;
import com.example.storefront.domain.exception.GatewayUnavailableException;
import com.example.storefront.domain.exception.PaymentAlreadyCompletedException;
import com.example.storefront.domain.exception.PaymentNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PaymentController.class)
class PaymentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PaymentService paymentService;

    @Test
    void unreachableGatewayIsBadGateway() throws Exception {
        when(paymentService.verifyPayment("PAY-1")).thenThrow(new GatewayUnavailableException("read timed out"));

        mockMvc.perform(get("/api/v1/payments/verify/PAY-1"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.errorCode").value("GATEWAY_UNAVAILABLE"));
    }

    @Test
    void unknownReferenceIsNotFound() throws Exception {
        when(paymentService.getPayment("PAY-x")).thenThrow(new PaymentNotFoundException("PAY-x"));

        mockMvc.perform(get("/api/v1/payments/PAY-x"))
                .andExpect(status().isNotFound());
    }

    @Test
    void reinitializingPaidPaymentIsConflict() throws Exception {
        when(paymentService.reinitializePayment("PAY-1")).thenThrow(new PaymentAlreadyCompletedException("PAY-1"));

        mockMvc.perform(post("/api/v1/payments/PAY-1/reinitialize"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("PAYMENT_ALREADY_COMPLETED"))
                .andExpect(jsonPath("$.details.paymentReference").value("PAY-1"));
    }

    @Test
    void resolvesBankAccount() throws Exception {
        when(paymentService.resolveBankAccount("0123456781", "058")).thenReturn(PayoutAccountResult.builder()
                .accountNumber("0123456781")
                .accountName("JANE SMITH")
                .bankCode("058")
                .bankName("Guaranty Trust Bank Plc (GTBank)")
                .build());

        mockMvc.perform(post("/api/v1/payments/bank-accounts/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accountNumber\":\"0123456781\",\"bankCode\":\"058\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accountName").value("JANE SMITH"))
                .andExpect(jsonPath("$.bankName").value("Guaranty Trust Bank Plc (GTBank)"));
    }

    @Test
    void listsBanks() throws Exception {
        when(paymentService.listBanks()).thenReturn(List.of(
                BankInfo.builder().name("Access Bank Plc").code("044").build(),
                BankInfo.builder().name("Sterling Bank Plc").code("232").build()));

        mockMvc.perform(get("/api/v1/payments/banks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].name").value("Sterling Bank Plc"))
                .andExpect(jsonPath("$[1].code").value("232"));

        verify(paymentService, never()).getPayment(anyString());
    }

    @Test
    void malformedAccountNumberIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/payments/bank-accounts/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accountNumber\":\"12ab\",\"bankCode\":\"058\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.accountNumber").value("Account number must be 10 digits"));

        verify(paymentService, never()).resolveBankAccount(anyString(), anyString());
    }
}
