package com.example.storefront.application.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Collection channel returned by the gateway. Either the account fields or
 * {@code checkoutUrl} (or both) are present.
 */
@Value
@Builder
public class ChannelProvisionResult {
    String gatewayReference;
    String checkoutUrl;
    String accountNumber;
    String accountName;
    String bankName;
    LocalDateTime expiresAt;
}
