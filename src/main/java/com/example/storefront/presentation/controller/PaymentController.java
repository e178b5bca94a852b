package com.example.storefront.presentation.controller;

import com.example.storefront.application.service.PaymentService;
import com.example.storefront.presentation.dto.request.ResolveBankAccountRequest;
import com.example.storefront.presentation.dto.response.BankAccountResponse;
import com.example.storefront.presentation.dto.response.BankResponse;
import com.example.storefront.presentation.dto.response.PaymentResponse;
import com.example.storefront.presentation.dto.response.VerifyPaymentResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private final PaymentService paymentService;

    /**
     * GET /api/v1/payments/verify/{reference}
     * Queries the gateway and reconciles before answering.
     */
    @GetMapping("/verify/{reference}")
    public ResponseEntity<VerifyPaymentResponse> verifyPayment(@PathVariable String reference) {
        log.debug("Payment verification requested: ref={}", reference);
        return ResponseEntity.ok(VerifyPaymentResponse.from(paymentService.verifyPayment(reference)));
    }

    @GetMapping("/{reference}")
    public ResponseEntity<PaymentResponse> getPayment(@PathVariable String reference) {
        return ResponseEntity.ok(PaymentResponse.from(paymentService.getPayment(reference)));
    }

    /**
     * POST /api/v1/payments/{reference}/reinitialize
     */
    @PostMapping("/{reference}/reinitialize")
    public ResponseEntity<PaymentResponse> reinitializePayment(@PathVariable String reference) {
        log.info("Payment reinitialization requested: ref={}", reference);
        return ResponseEntity.ok(PaymentResponse.from(paymentService.reinitializePayment(reference)));
    }

    /**
     * GET /api/v1/payments/banks
     */
    @GetMapping("/banks")
    public ResponseEntity<List<BankResponse>> listBanks() {
        return ResponseEntity.ok(paymentService.listBanks().stream()
                .map(BankResponse::from)
                .collect(Collectors.toList()));
    }

    @PostMapping("/bank-accounts/resolve")
    public ResponseEntity<BankAccountResponse> resolveBankAccount(@Valid @RequestBody ResolveBankAccountRequest request) {
        return ResponseEntity.ok(BankAccountResponse.from(
                paymentService.resolveBankAccount(request.getAccountNumber(), request.getBankCode())));
    }
}
