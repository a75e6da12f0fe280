package com.amannmalik.ucp.client;

public enum HttpMethod {
    GET(false),
    POST(true),
    PUT(true);

    private final boolean mutating;

    HttpMethod(final boolean mutating) {
        this.mutating = mutating;
    }

    /// Mutating requests carry an idempotency key.
    public boolean mutating() {
        return mutating;
    }
}
