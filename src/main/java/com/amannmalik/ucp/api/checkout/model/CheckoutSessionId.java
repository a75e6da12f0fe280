package com.amannmalik.ucp.api.checkout.model;

public record CheckoutSessionId(String value) {
    public CheckoutSessionId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Checkout session id must be non-blank");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
