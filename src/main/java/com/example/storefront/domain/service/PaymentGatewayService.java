package com.example.storefront.domain.service;

import com.example.storefront.application.dto.ChannelProvisionRequest;
import com.example.storefront.application.dto.ChannelProvisionResult;
import com.example.storefront.application.dto.GatewayStatusResult;
import com.example.storefront.application.dto.PayoutAccountResult;

/**
 * Payment gateway port
 * - implemented in the infrastructure layer
 * - no retries inside implementations; failures surface as exceptions
 */
public interface PaymentGatewayService {

    /**
     * Provision a collection channel (virtual account or checkout link) for an amount
     */
    ChannelProvisionResult provisionChannel(ChannelProvisionRequest request);

    /**
     * Current status of a payment as the gateway sees it
     */
    GatewayStatusResult queryStatus(String paymentReference);

    /**
     * Resolve the holder name of a payout account
     */
    PayoutAccountResult validatePayoutAccount(String accountNumber, String bankCode);

    String getGatewayName();

    boolean isHealthy();
}
