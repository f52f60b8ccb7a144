package com.flagship.settlement_engine.intake;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Verifies the processor's webhook signature.
 *
 * Header format: {@code t=<epoch seconds>,v1=<hex>[,v1=<hex>...]}, where
 * v1 = HMAC-SHA256(secret, "<t>.<raw body>"). Several v1 values are accepted
 * so the processor can roll its secret. Comparison is constant-time and the
 * timestamp must be within the configured tolerance of the local clock.
 */
@Component
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    private final byte[] secret;
    private final Duration tolerance;
    private final Clock clock;

    @Autowired
    public WebhookSignatureVerifier(@Value("${settlement.intake.signing-secret}") String secret,
                                    @Value("${settlement.intake.signature-tolerance:PT5M}") Duration tolerance) {
        this(secret, tolerance, Clock.systemUTC());
    }

    public WebhookSignatureVerifier(String secret, Duration tolerance, Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Webhook signing secret must be configured");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.tolerance = tolerance;
        this.clock = clock;
    }

    /**
     * @throws InvalidSignatureException if the header is missing, malformed,
     *         stale or does not match the body
     */
    public void verify(byte[] body, String signatureHeader) {
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new InvalidSignatureException("Missing signature header");
        }

        Long timestamp = null;
        List<String> signatures = new ArrayList<>();
        for (String part : signatureHeader.split(",")) {
            String[] pair = part.trim().split("=", 2);
            if (pair.length != 2) {
                continue;
            }
            if ("t".equals(pair[0])) {
                try {
                    timestamp = Long.parseLong(pair[1]);
                } catch (NumberFormatException e) {
                    throw new InvalidSignatureException("Signature timestamp is not a number");
                }
            } else if ("v1".equals(pair[0])) {
                signatures.add(pair[1]);
            }
        }

        if (timestamp == null || signatures.isEmpty()) {
            throw new InvalidSignatureException("Signature header lacks timestamp or v1 signature");
        }

        long ageSeconds = Math.abs(clock.instant().getEpochSecond() - timestamp);
        if (ageSeconds > tolerance.getSeconds()) {
            throw new InvalidSignatureException("Signature timestamp outside tolerance");
        }

        byte[] expected = hmac(timestamp, body);
        for (String candidate : signatures) {
            byte[] provided;
            try {
                provided = HexFormat.of().parseHex(candidate);
            } catch (IllegalArgumentException e) {
                continue;
            }
            if (MessageDigest.isEqual(expected, provided)) {
                return;
            }
        }
        throw new InvalidSignatureException("Signature does not match payload");
    }

    /**
     * Builds a header value for the given body. Used by tooling that replays
     * events against this endpoint.
     */
    public String sign(long timestamp, byte[] body) {
        return "t=" + timestamp + ",v1=" + HexFormat.of().formatHex(hmac(timestamp, body));
    }

    private byte[] hmac(long timestamp, byte[] body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            mac.update((timestamp + ".").getBytes(StandardCharsets.UTF_8));
            return mac.doFinal(body);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }
}
