package com.example.storefront.infrastructure.gateway.monnify;

import com.example.storefront.application.dto.ChannelProvisionRequest;
import com.example.storefront.application.dto.ChannelProvisionResult;
import com.example.storefront.application.dto.GatewayStatusResult;
import com.example.storefront.domain.exception.GatewayUnavailableException;
import com.example.storefront.domain.model.payment.GatewayPaymentOutcome;
import com.example.storefront.infrastructure.config.StorefrontProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class MonnifyPaymentGatewayTest {

    private static final String BASE = "https://sandbox.monnify.test";
    private static final String LOGIN = "{\"requestSuccessful\":true,\"responseBody\":{\"accessToken\":\"tok-1\",\"expiresIn\":299}}";

    private MockRestServiceServer server;
    private MonnifyPaymentGateway gateway;

    @BeforeEach
    void setUp() {
        StorefrontProperties properties = new StorefrontProperties();
        properties.getMonnify().setBaseUrl(BASE);
        properties.getMonnify().setApiKey("MK_TEST_KEY");
        properties.getMonnify().setSecretKey("SECRET");
        properties.getMonnify().setContractCode("1234567");

        RestTemplate restTemplate = new RestTemplateBuilder().rootUri(BASE).build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        gateway = new MonnifyPaymentGateway(restTemplate, properties);
    }

    @Test
    void provisionsDynamicAccount() {
        String basic = Base64.getEncoder().encodeToString("MK_TEST_KEY:SECRET".getBytes(StandardCharsets.UTF_8));
        server.expect(requestTo(BASE + "/api/v1/auth/login"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Basic " + basic))
                .andRespond(withSuccess(LOGIN, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/v1/merchant/transactions/init-transaction"))
                .andExpect(header("Authorization", "Bearer tok-1"))
                .andExpect(jsonPath("$.paymentReference").value("PAY-0b6f4c1e-a1b2c3d4"))
                .andExpect(jsonPath("$.contractCode").value("1234567"))
                .andExpect(jsonPath("$.paymentMethods[0]").value("ACCOUNT_TRANSFER"))
                .andRespond(withSuccess("{\"requestSuccessful\":true,\"responseBody\":"
                        + "{\"transactionReference\":\"MNFY|20240815|1\",\"checkoutUrl\":\"https://checkout/1\"}}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/v1/merchant/bank-transfer/init-payment"))
                .andExpect(jsonPath("$.transactionReference").value("MNFY|20240815|1"))
                .andExpect(jsonPath("$.bankCode").value("232"))
                .andRespond(withSuccess("{\"requestSuccessful\":true,\"responseBody\":{"
                        + "\"accountNumber\":\"5000000001\",\"accountName\":\"STORE-Ada Obi\","
                        + "\"bankName\":\"Sterling bank\",\"expiresOn\":\"2024-08-16 10:00:00.000\"}}",
                        MediaType.APPLICATION_JSON));

        ChannelProvisionResult channel = gateway.provisionChannel(request());

        assertEquals("MNFY|20240815|1", channel.getGatewayReference());
        assertEquals("5000000001", channel.getAccountNumber());
        assertEquals("Sterling bank", channel.getBankName());
        assertNull(channel.getCheckoutUrl());
        assertEquals(LocalDateTime.of(2024, 8, 16, 10, 0), channel.getExpiresAt());
        server.verify();
    }

    @Test
    void fallsBackToCheckoutUrl() {
        server.expect(requestTo(BASE + "/api/v1/auth/login"))
                .andRespond(withSuccess(LOGIN, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/v1/merchant/transactions/init-transaction"))
                .andRespond(withSuccess("{\"requestSuccessful\":true,\"responseBody\":"
                        + "{\"transactionReference\":\"MNFY|2\",\"checkoutUrl\":\"https://checkout/2\"}}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/v1/merchant/bank-transfer/init-payment"))
                .andRespond(withSuccess("{\"requestSuccessful\":false,\"responseMessage\":\"not enabled\"}",
                        MediaType.APPLICATION_JSON));

        ChannelProvisionResult channel = gateway.provisionChannel(request());

        assertEquals("https://checkout/2", channel.getCheckoutUrl());
        assertNull(channel.getAccountNumber());
        assertEquals("MNFY|2", channel.getGatewayReference());
    }

    @Test
    void serverErrorIsGatewayUnavailable() {
        server.expect(requestTo(BASE + "/api/v1/auth/login"))
                .andRespond(withSuccess(LOGIN, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/v1/merchant/transactions/init-transaction"))
                .andRespond(withServerError());

        assertThrows(GatewayUnavailableException.class, () -> gateway.provisionChannel(request()));
    }

    @Test
    void failedLoginIsGatewayUnavailable() {
        server.expect(requestTo(BASE + "/api/v1/auth/login"))
                .andRespond(withServerError());

        assertThrows(GatewayUnavailableException.class, () -> gateway.queryStatus("PAY-1"));
    }

    @Test
    void statusQueryMapsOutcomeAndReusesToken() {
        server.expect(requestTo(BASE + "/api/v1/auth/login"))
                .andRespond(withSuccess(LOGIN, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/v2/merchant/transactions/query?paymentReference=PAY-1"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"requestSuccessful\":true,\"responseBody\":{"
                        + "\"paymentStatus\":\"OVERPAID\",\"transactionReference\":\"MNFY|9\","
                        + "\"paymentMethod\":\"ACCOUNT_TRANSFER\",\"amountPaid\":2300.00}}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/v2/merchant/transactions/query?paymentReference=PAY-2"))
                .andExpect(header("Authorization", "Bearer tok-1"))
                .andRespond(withSuccess("{\"requestSuccessful\":false,\"responseMessage\":\"not found\"}",
                        MediaType.APPLICATION_JSON));

        GatewayStatusResult paid = gateway.queryStatus("PAY-1");
        GatewayStatusResult unknown = gateway.queryStatus("PAY-2");

        assertEquals(GatewayPaymentOutcome.OVERPAID, paid.getOutcome());
        assertEquals("MNFY|9", paid.getGatewayReference());
        assertEquals(0, new BigDecimal("2300.00").compareTo(paid.getAmountPaid()));
        assertEquals(GatewayPaymentOutcome.PENDING, unknown.getOutcome());
        server.verify();
    }

    private static ChannelProvisionRequest request() {
        return ChannelProvisionRequest.builder()
                .amount(new BigDecimal("2250.00"))
                .currency("NGN")
                .paymentReference("PAY-0b6f4c1e-a1b2c3d4")
                .payerName("Ada Obi")
                .payerEmail("ada@example.com")
                .description("Payment for order 0b6f4c1e")
                .build();
    }
}
