package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;

import java.util.List;

public record FulfillmentOption(String id, String title, List<Total> totals) {
    public FulfillmentOption {
        id = Ensure.nonBlank("fulfillment_option.id", id);
        totals = Ensure.immutableListOrEmpty(totals);
    }
}
