package com.amannmalik.ucp.api.shared;

import com.amannmalik.ucp.util.Ensure;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * ISO-4217 currency code as UCP merchants exchange it (upper case).
 */
public record CurrencyCode(String value) {
    private static final Pattern ISO_4217 = Pattern.compile("^[A-Z]{3}$");

    public static final CurrencyCode USD = new CurrencyCode("USD");

    public CurrencyCode {
        var normalized = Ensure.nonBlank("currency", value).trim().toUpperCase(Locale.ROOT);
        if (!ISO_4217.matcher(normalized).matches()) {
            throw new IllegalArgumentException("currency MUST be an ISO-4217 code");
        }
        value = normalized;
    }

    @Override
    public String toString() {
        return value;
    }
}
