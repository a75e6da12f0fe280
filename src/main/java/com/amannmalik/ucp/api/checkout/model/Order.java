package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;

import java.net.URI;

/**
 * Receipt attached to a completed session. Merchants are not required to expose a permalink.
 */
public record Order(String id, URI permalinkUrl) {
    public Order {
        id = Ensure.nonBlank("order.id", id);
    }
}
