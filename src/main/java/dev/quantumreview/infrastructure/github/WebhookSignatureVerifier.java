package dev.quantumreview.infrastructure.github;

import dev.quantumreview.config.GitHubProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 verification of {@code X-Hub-Signature-256} over the raw request body.
 * Runs before the body is parsed. A missing secret or malformed header fails closed.
 */
@Component
public class WebhookSignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookSignatureVerifier.class);
    private static final String PREFIX = "sha256=";
    private static final String ALGORITHM = "HmacSHA256";

    private final GitHubProperties properties;

    public WebhookSignatureVerifier(GitHubProperties properties) {
        this.properties = properties;
    }

    public boolean verify(byte[] rawBody, String signatureHeader) {
        if (signatureHeader == null || !signatureHeader.startsWith(PREFIX)) return false;
        String secret = properties.webhookSecret();
        if (secret == null || secret.isBlank()) {
            log.error("Webhook secret is not configured, rejecting delivery");
            return false;
        }
        byte[] provided;
        try {
            provided = HexFormat.of().parseHex(signatureHeader.substring(PREFIX.length()));
        } catch (IllegalArgumentException e) {
            log.debug("Signature header is not hex: {}", e.getMessage());
            return false;
        }
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] expected = mac.doFinal(rawBody == null ? new byte[0] : rawBody);
            return MessageDigest.isEqual(expected, provided);
        } catch (GeneralSecurityException e) {
            log.error("HMAC computation failed", e);
            return false;
        }
    }
}
