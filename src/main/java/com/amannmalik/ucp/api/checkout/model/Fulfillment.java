package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;

import java.util.List;

public record Fulfillment(List<FulfillmentMethod> methods) {
    public Fulfillment {
        methods = Ensure.immutableListOrEmpty(methods);
    }
}
