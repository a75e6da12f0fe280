package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;

public record Buyer(String fullName, String email) {
    public Buyer {
        fullName = Ensure.nonBlank("buyer.full_name", fullName);
        email = Ensure.nonBlank("buyer.email", email);
    }
}
