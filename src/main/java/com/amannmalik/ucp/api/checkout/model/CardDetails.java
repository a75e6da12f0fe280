package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;

import java.util.regex.Pattern;

public record CardDetails(String brand, String lastDigits, String token) {
    private static final Pattern LAST_DIGITS = Pattern.compile("^[0-9]{4}$");

    public CardDetails {
        brand = Ensure.nonBlank("card.brand", brand);
        lastDigits = Ensure.nonBlank("card.last_digits", lastDigits);
        if (!LAST_DIGITS.matcher(lastDigits).matches()) {
            throw new IllegalArgumentException("card.last_digits MUST be four digits");
        }
        token = Ensure.nonBlank("card.token", token);
    }

    @Override
    public String toString() {
        return "CardDetails[brand=" + brand + ", lastDigits=" + lastDigits + ", token=***]";
    }
}
