package com.amannmalik.ucp.client;

import com.amannmalik.ucp.util.Ensure;

/**
 * Sends the same opaque signature on every request. Enough for merchants that accept
 * unsigned agents; use {@link HmacRequestSigner} where signatures are verified.
 */
public final class StaticRequestSigner implements RequestSigner {
    public static final String PLACEHOLDER = "test";

    private final String signature;

    public StaticRequestSigner(String signature) {
        this.signature = Ensure.nonBlank("request_signature", signature);
    }

    public static StaticRequestSigner placeholder() {
        return new StaticRequestSigner(PLACEHOLDER);
    }

    @Override
    public String sign(HttpMethod method, String path, String body) {
        return signature;
    }
}
