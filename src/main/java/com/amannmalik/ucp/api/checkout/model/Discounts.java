package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;

import java.util.List;

public record Discounts(List<String> codes, List<AppliedDiscount> applied) {
    private static final Discounts NONE = new Discounts(List.of(), List.of());

    public Discounts {
        codes = Ensure.immutableListOrEmpty(codes);
        applied = Ensure.immutableListOrEmpty(applied);
    }

    public static Discounts none() {
        return NONE;
    }

    public boolean isEmpty() {
        return codes.isEmpty() && applied.isEmpty();
    }
}
