package uk.gegc.creatorbilling.features.billing.infra.webhook;

import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 over the raw request body, compared in constant time.
 */
@Component
public class HmacSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    public boolean verify(String payload, String signatureHex, String secret) {
        if (payload == null || signatureHex == null || signatureHex.isBlank() || secret == null || secret.isBlank()) {
            return false;
        }
        byte[] expected = hmac(payload, secret);
        byte[] provided;
        try {
            provided = HexFormat.of().parseHex(signatureHex.trim().toLowerCase());
        } catch (IllegalArgumentException e) {
            return false;
        }
        return MessageDigest.isEqual(expected, provided);
    }

    public String sign(String payload, String secret) {
        return HexFormat.of().formatHex(hmac(payload, secret));
    }

    private byte[] hmac(String payload, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
