package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.api.shared.MinorUnitAmount;
import com.amannmalik.ucp.util.Ensure;

public record AppliedDiscount(String code, String title, MinorUnitAmount amount, boolean automatic) {
    public AppliedDiscount {
        code = Ensure.nonBlank("applied_discount.code", code);
        amount = Ensure.notNull("applied_discount.amount", amount);
    }
}
