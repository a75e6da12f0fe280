package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.api.shared.MinorUnitAmount;
import com.amannmalik.ucp.util.Ensure;

public record Total(String type, MinorUnitAmount amount, String displayText) {
    public static final String SUBTOTAL = "subtotal";
    public static final String DISCOUNT = "discount";
    public static final String FULFILLMENT = "fulfillment";
    public static final String TAX = "tax";
    public static final String TOTAL = "total";

    public Total {
        type = Ensure.nonBlank("total.type", type);
        amount = amount == null ? MinorUnitAmount.zero() : amount;
        displayText = Ensure.nonBlankOrNull("total.display_text", displayText);
    }

    public Total(String type, long amount) {
        this(type, new MinorUnitAmount(amount), null);
    }

    public boolean hasType(String candidate) {
        return type.equals(candidate);
    }
}
