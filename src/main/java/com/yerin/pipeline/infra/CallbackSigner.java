package com.yerin.pipeline.infra;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 over the exact callback body, rendered as {@code sha256=<hex>}.
 */
public class CallbackSigner {

    public static final String PREFIX = "sha256=";

    private final byte[] secret;

    public CallbackSigner(String secret) {
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
    }

    public String sign(byte[] body) {
        return PREFIX + HexFormat.of().formatHex(hmacSha256(body));
    }

    public boolean verify(byte[] body, String headerValue) {
        if (headerValue == null || !headerValue.startsWith(PREFIX)) return false;
        byte[] expected = sign(body).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, headerValue.getBytes(StandardCharsets.US_ASCII));
    }

    private byte[] hmacSha256(byte[] data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret, "HmacSHA256"));
            return mac.doFinal(data);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }
}
