package com.example.storefront.infrastructure.gateway;

import com.example.storefront.application.dto.ChannelProvisionRequest;
import com.example.storefront.application.dto.ChannelProvisionResult;
import com.example.storefront.application.dto.GatewayStatusResult;
import com.example.storefront.application.dto.PayoutAccountResult;
import com.example.storefront.domain.model.payment.GatewayPaymentOutcome;
import com.example.storefront.domain.service.PaymentGatewayService;
import com.example.storefront.infrastructure.config.StorefrontProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Deterministic gateway for local development
 * - used whenever no Monnify API key is configured
 * - every channel is the same fixed account; every status query reports pending
 */
@Component
@Slf4j
public class MockPaymentGateway implements PaymentGatewayService {

    public static final String NAME = "MOCK_PAYMENT_GATEWAY";

    static final String MOCK_ACCOUNT_NUMBER = "1234567890";
    static final String MOCK_BANK_NAME = "Wema Bank";
    static final String ACCOUNT_NAME_PREFIX = "STORE";

    private static final List<String> MOCK_ACCOUNT_NAMES = List.of(
            "JOHN DOE", "JANE SMITH", "ADEBAYO EMMANUEL", "CHIOMA OKONKWO", "IBRAHIM MUSA");

    private final StorefrontProperties properties;

    public MockPaymentGateway(StorefrontProperties properties) {
        this.properties = properties;
    }

    @Override
    public ChannelProvisionResult provisionChannel(ChannelProvisionRequest request) {
        log.info("Mock payment channel created: ref={}, amount={}", request.getPaymentReference(), request.getAmount());

        return ChannelProvisionResult.builder()
                .accountNumber(MOCK_ACCOUNT_NUMBER)
                .accountName(accountNameFor(request.getPayerName()))
                .bankName(MOCK_BANK_NAME)
                .expiresAt(LocalDateTime.now().plus(properties.getPayments().getChannelValidity()))
                .build();
    }

    private static String accountNameFor(String payerName) {
        if (payerName == null || payerName.isBlank()) {
            return ACCOUNT_NAME_PREFIX;
        }
        return ACCOUNT_NAME_PREFIX + "-" + payerName.trim();
    }

    @Override
    public GatewayStatusResult queryStatus(String paymentReference) {
        log.info("Mock payment verification: ref={}", paymentReference);

        return GatewayStatusResult.builder()
                .paymentReference(paymentReference)
                .outcome(GatewayPaymentOutcome.PENDING)
                .build();
    }

    @Override
    public PayoutAccountResult validatePayoutAccount(String accountNumber, String bankCode) {
        int index = Character.digit(accountNumber.charAt(accountNumber.length() - 1), 10);
        String accountName = MOCK_ACCOUNT_NAMES.get(Math.max(index, 0) % MOCK_ACCOUNT_NAMES.size());

        log.info("Mock bank account validation: account={}, bank={}", accountNumber, bankCode);

        return PayoutAccountResult.builder()
                .accountNumber(accountNumber)
                .accountName(accountName)
                .bankCode(bankCode)
                .build();
    }

    @Override
    public String getGatewayName() {
        return NAME;
    }

    @Override
    public boolean isHealthy() {
        return true;
    }
}
