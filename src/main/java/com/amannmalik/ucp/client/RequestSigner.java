package com.amannmalik.ucp.client;

/**
 * Produces the {@code request-signature} header value for an outbound request.
 */
@FunctionalInterface
public interface RequestSigner {
    String sign(HttpMethod method, String path, String body);
}
