package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;

import java.util.Locale;
import java.util.regex.Pattern;

public record PostalAddress(
        String firstName,
        String lastName,
        String streetAddress,
        String addressLocality,
        String addressRegion,
        String postalCode,
        String addressCountry) {
    private static final int LINE_MAX = 60;
    private static final Pattern ISO_COUNTRY = Pattern.compile("^[A-Z]{2}$");

    public PostalAddress {
        firstName = Ensure.nonBlankOrNull("address.first_name", firstName);
        lastName = Ensure.nonBlankOrNull("address.last_name", lastName);
        streetAddress = Ensure.nonBlank("address.street_address", streetAddress);
        ensureMaxLength("address.street_address", streetAddress);
        addressLocality = Ensure.nonBlank("address.address_locality", addressLocality);
        ensureMaxLength("address.address_locality", addressLocality);
        addressRegion = Ensure.nonBlankOrNull("address.address_region", addressRegion);
        postalCode = Ensure.nonBlank("address.postal_code", postalCode);
        addressCountry = normalizeCountry(addressCountry);
    }

    /// Stand-in billing address sent when the caller only supplies a card token.
    public static PostalAddress placeholder() {
        return new PostalAddress("John", "Doe", "123 Main St", "Springfield", "IL", "62701", "US");
    }

    private static String normalizeCountry(String value) {
        var normalized = Ensure.nonBlank("address.address_country", value).toUpperCase(Locale.ROOT);
        if (!ISO_COUNTRY.matcher(normalized).matches()) {
            throw new IllegalArgumentException("address.address_country MUST be ISO-3166-1 alpha-2");
        }
        return normalized;
    }

    private static void ensureMaxLength(String field, String value) {
        if (value.length() > LINE_MAX) {
            throw new IllegalArgumentException(field + " MUST be <= " + LINE_MAX + " characters");
        }
    }
}
