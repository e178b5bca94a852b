package com.example.storefront.application.dto;

import lombok.Value;

/**
 * Acknowledgement of a gateway callback; {@code processed} is false for
 * event types this service ignores
 */
@Value(staticConstructor = "of")
public class WebhookOutcome {
    String eventType;
    boolean processed;
}
