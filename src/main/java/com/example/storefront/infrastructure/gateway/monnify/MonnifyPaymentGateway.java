package com.example.storefront.infrastructure.gateway.monnify;

import com.example.storefront.application.dto.ChannelProvisionRequest;
import com.example.storefront.application.dto.ChannelProvisionResult;
import com.example.storefront.application.dto.GatewayStatusResult;
import com.example.storefront.application.dto.PayoutAccountResult;
import com.example.storefront.domain.exception.GatewayUnavailableException;
import com.example.storefront.domain.model.payment.GatewayPaymentOutcome;
import com.example.storefront.domain.service.PaymentGatewayService;
import com.example.storefront.infrastructure.config.StorefrontProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Monnify adapter
 * - bearer token from /api/v1/auth/login, cached for 4 minutes (Monnify issues 5)
 * - channel: init-transaction, then bank-transfer/init-payment for a dynamic account;
 *   falls back to the hosted checkout URL when account provisioning fails
 * - no retries here; the caller's circuit breaker decides
 */
@Component
@Slf4j
public class MonnifyPaymentGateway implements PaymentGatewayService {

    public static final String NAME = "MONNIFY";

    private static final Duration TOKEN_TTL = Duration.ofMinutes(4);
    private static final String DEFAULT_CUSTOMER_EMAIL = "customer@example.com";
    private static final String TRANSFER_BANK_CODE = "232";
    private static final DateTimeFormatter MONNIFY_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSS]");

    private final RestTemplate restTemplate;
    private final StorefrontProperties properties;

    private String accessToken;
    private LocalDateTime tokenExpiresAt;

    public MonnifyPaymentGateway(@Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
                                 StorefrontProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public ChannelProvisionResult provisionChannel(ChannelProvisionRequest request) {
        StorefrontProperties.Monnify monnify = properties.getMonnify();
        LocalDateTime defaultExpiry = LocalDateTime.now().plus(properties.getPayments().getChannelValidity());

        Map<String, Object> initBody = new LinkedHashMap<>();
        initBody.put("amount", request.getAmount());
        initBody.put("customerName", request.getPayerName());
        initBody.put("customerEmail", request.getPayerEmail() != null ? request.getPayerEmail() : DEFAULT_CUSTOMER_EMAIL);
        initBody.put("paymentReference", request.getPaymentReference());
        initBody.put("paymentDescription", request.getDescription());
        initBody.put("currencyCode", request.getCurrency());
        initBody.put("contractCode", monnify.getContractCode());
        initBody.put("redirectUrl", monnify.getRedirectUrl());
        initBody.put("paymentMethods", List.of("ACCOUNT_TRANSFER"));

        JsonNode initResponse = call(HttpMethod.POST, "/api/v1/merchant/transactions/init-transaction", initBody);
        if (!initResponse.path("requestSuccessful").asBoolean(false)) {
            log.error("Monnify init transaction failed: ref={}, message={}",
                    request.getPaymentReference(), initResponse.path("responseMessage").asText());
            throw new GatewayUnavailableException("Failed to initialize transaction");
        }

        JsonNode initBodyNode = initResponse.path("responseBody");
        String transactionReference = initBodyNode.path("transactionReference").asText(null);

        Map<String, Object> transferBody = new LinkedHashMap<>();
        transferBody.put("transactionReference", transactionReference);
        transferBody.put("bankCode", TRANSFER_BANK_CODE);

        JsonNode transferResponse = call(HttpMethod.POST, "/api/v1/merchant/bank-transfer/init-payment", transferBody);
        if (!transferResponse.path("requestSuccessful").asBoolean(false)) {
            String checkoutUrl = initBodyNode.path("checkoutUrl").asText(null);
            log.warn("Monnify bank transfer init failed, using checkout URL: ref={}, message={}",
                    request.getPaymentReference(), transferResponse.path("responseMessage").asText());
            return ChannelProvisionResult.builder()
                    .gatewayReference(transactionReference)
                    .checkoutUrl(checkoutUrl)
                    .expiresAt(defaultExpiry)
                    .build();
        }

        JsonNode body = transferResponse.path("responseBody");
        log.info("Monnify dynamic account provisioned: ref={}, transactionRef={}",
                request.getPaymentReference(), transactionReference);

        return ChannelProvisionResult.builder()
                .gatewayReference(transactionReference)
                .accountNumber(body.path("accountNumber").asText(""))
                .accountName(body.path("accountName").asText(""))
                .bankName(body.path("bankName").asText(""))
                .expiresAt(parseDate(body.path("expiresOn").asText(null), defaultExpiry))
                .build();
    }

    @Override
    public GatewayStatusResult queryStatus(String paymentReference) {
        JsonNode response = call(HttpMethod.GET,
                "/api/v2/merchant/transactions/query?paymentReference={ref}", null, paymentReference);

        if (!response.path("requestSuccessful").asBoolean(false)) {
            log.warn("Monnify status query unsuccessful: ref={}, message={}",
                    paymentReference, response.path("responseMessage").asText());
            return GatewayStatusResult.builder()
                    .paymentReference(paymentReference)
                    .outcome(GatewayPaymentOutcome.PENDING)
                    .build();
        }

        JsonNode body = response.path("responseBody");
        GatewayPaymentOutcome outcome = GatewayPaymentOutcome.parse(body.path("paymentStatus").asText(null))
                .orElse(GatewayPaymentOutcome.PENDING);

        return GatewayStatusResult.builder()
                .paymentReference(paymentReference)
                .gatewayReference(body.path("transactionReference").asText(null))
                .outcome(outcome)
                .paymentMethod(body.path("paymentMethod").asText(null))
                .amountPaid(body.hasNonNull("amountPaid") ? new BigDecimal(body.get("amountPaid").asText()) : null)
                .build();
    }

    @Override
    public PayoutAccountResult validatePayoutAccount(String accountNumber, String bankCode) {
        JsonNode response = call(HttpMethod.GET,
                "/api/v1/disbursements/account/validate?accountNumber={account}&bankCode={bank}",
                null, accountNumber, bankCode);

        if (!response.path("requestSuccessful").asBoolean(false)) {
            log.error("Monnify bank validation failed: account={}, message={}",
                    accountNumber, response.path("responseMessage").asText());
            throw new GatewayUnavailableException("Failed to validate bank account");
        }

        JsonNode body = response.path("responseBody");
        return PayoutAccountResult.builder()
                .accountNumber(body.path("accountNumber").asText(accountNumber))
                .accountName(body.path("accountName").asText(null))
                .bankCode(bankCode)
                .build();
    }

    @Override
    public String getGatewayName() {
        return NAME;
    }

    @Override
    public boolean isHealthy() {
        try {
            getAccessToken();
            return true;
        } catch (RuntimeException e) {
            log.warn("Monnify health check failed: {}", e.getMessage());
            return false;
        }
    }

    private JsonNode call(HttpMethod method, String path, Object body, Object... uriVariables) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(getAccessToken());

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    path, method, new HttpEntity<>(body, headers), JsonNode.class, uriVariables);
            if (response.getBody() == null) {
                throw new GatewayUnavailableException("Empty response from Monnify: " + path);
            }
            return response.getBody();
        } catch (RestClientException e) {
            throw new GatewayUnavailableException("Monnify request failed: " + path, e);
        }
    }

    private synchronized String getAccessToken() {
        if (accessToken != null && tokenExpiresAt != null && LocalDateTime.now().isBefore(tokenExpiresAt)) {
            return accessToken;
        }

        StorefrontProperties.Monnify monnify = properties.getMonnify();
        String credentials = monnify.getApiKey() + ":" + monnify.getSecretKey();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.AUTHORIZATION,
                "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));

        JsonNode response;
        try {
            response = restTemplate.postForObject("/api/v1/auth/login", new HttpEntity<>(null, headers), JsonNode.class);
        } catch (RestClientException e) {
            log.error("Monnify auth failed: {}", e.getMessage());
            throw new GatewayUnavailableException("Failed to authenticate with Monnify", e);
        }

        String token = response == null ? null : response.path("responseBody").path("accessToken").asText(null);
        if (token == null) {
            throw new GatewayUnavailableException("Failed to authenticate with Monnify");
        }

        accessToken = token;
        tokenExpiresAt = LocalDateTime.now().plus(TOKEN_TTL);
        return accessToken;
    }

    private LocalDateTime parseDate(String raw, LocalDateTime fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return LocalDateTime.parse(raw, MONNIFY_DATE);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(raw).toLocalDateTime();
            } catch (DateTimeParseException ignored) {
                log.debug("Unparseable Monnify expiry '{}', using default", raw);
                return fallback;
            }
        }
    }
}
