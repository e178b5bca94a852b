package com.example.storefront.infrastructure.gateway;

import com.example.storefront.domain.exception.WebhookSignatureException;
import com.example.storefront.infrastructure.config.StorefrontProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Monnify webhook signatures: hex HMAC-SHA512 of the raw request body.
 * Only enforced in production with a configured secret; other environments
 * accept unsigned payloads for local testing.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA512";

    private final StorefrontProperties properties;

    public boolean isEnforced() {
        String secret = properties.getMonnify().getWebhookSecret();
        return properties.isProduction() && secret != null && !secret.isBlank();
    }

    /**
     * @throws WebhookSignatureException when enforced and the signature is missing or wrong
     */
    public void verify(byte[] payload, String signature) {
        if (!isEnforced()) {
            return;
        }
        if (signature == null || signature.isBlank()) {
            log.warn("Missing Monnify signature");
            throw new WebhookSignatureException("Missing webhook signature");
        }
        if (!matches(payload, signature, properties.getMonnify().getWebhookSecret())) {
            log.warn("Invalid Monnify signature");
            throw new WebhookSignatureException("Invalid webhook signature");
        }
    }

    static boolean matches(byte[] payload, String signature, String secret) {
        byte[] expected = sign(payload, secret).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = signature.trim().toLowerCase().getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    static String sign(byte[] payload, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA512 unavailable", e);
        }
    }
}
