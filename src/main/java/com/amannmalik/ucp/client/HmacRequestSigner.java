package com.amannmalik.ucp.client;

import com.amannmalik.ucp.util.Ensure;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;

/**
 * HMAC-SHA256 over {@code METHOD\npath\nbody}, emitted as {@code keyId=<id>,sig=<base64url>}.
 */
public final class HmacRequestSigner implements RequestSigner {
    private static final Base64.Encoder SIGNATURE_ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final String ALGORITHM = "HmacSHA256";

    private final String keyId;
    private final byte[] secret;

    public HmacRequestSigner(String keyId, byte[] secret) {
        this.keyId = Ensure.nonBlank("signature.key_id", keyId);
        Ensure.notNull("signature.secret", secret);
        if (secret.length == 0) {
            throw new IllegalArgumentException("signature.secret MUST NOT be empty");
        }
        this.secret = secret.clone();
    }

    static String canonicalPayload(HttpMethod method, String path, String body) {
        return method.name() + "\n" + path + "\n" + (body == null ? "" : body);
    }

    @Override
    public String sign(HttpMethod method, String path, String body) {
        var mac = newMac();
        var signature = mac.doFinal(canonicalPayload(method, path, body).getBytes(StandardCharsets.UTF_8));
        return "keyId=" + keyId + ",sig=" + SIGNATURE_ENCODER.encodeToString(signature);
    }

    private Mac newMac() {
        try {
            var mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return mac;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to initialize request signature", e);
        }
    }
}
