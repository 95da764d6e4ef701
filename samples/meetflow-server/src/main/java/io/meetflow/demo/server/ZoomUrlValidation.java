package io.meetflow.demo.server;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;

/**
 * Answers Zoom's {@code endpoint.url_validation} challenge: the plain token is echoed together
 * with its hex HMAC-SHA256 under the app's secret token.
 */
final class ZoomUrlValidation {
    private static final String ALGORITHM = "HmacSHA256";

    private ZoomUrlValidation() {
    }

    static Map<String, String> respond(String plainToken, String secretToken) {
        Objects.requireNonNull(plainToken, "plainToken");
        if (secretToken == null || secretToken.isEmpty()) {
            throw new IllegalStateException("meetflow.server.zoom-secret-token is not configured");
        }
        return Map.of(
            "plainToken", plainToken,
            "encryptedToken", hmacHex(plainToken, secretToken));
    }

    static String hmacHex(String message, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(message.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
