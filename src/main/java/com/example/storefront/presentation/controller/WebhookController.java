package com.example.storefront.presentation.controller;

import com.example.storefront.application.dto.WebhookOutcome;
import com.example.storefront.application.service.PaymentService;
import com.example.storefront.presentation.dto.response.MessageResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Gateway callbacks. The body is taken raw so the signature is checked over
 * the exact bytes Monnify signed.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    static final String SIGNATURE_HEADER = "monnify-signature";

    private final PaymentService paymentService;

    @PostMapping("/monnify")
    public ResponseEntity<MessageResponse> monnifyWebhook(
            @RequestBody byte[] body,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {

        WebhookOutcome outcome = paymentService.handleWebhook(body, signature);
        String message = outcome.isProcessed()
                ? "Webhook processed successfully"
                : "Webhook event ignored";
        return ResponseEntity.ok(new MessageResponse(true, message));
    }
}
