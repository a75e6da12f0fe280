package com.amannmalik.ucp.codec;

import com.amannmalik.ucp.api.checkout.model.PostalAddress;
import jakarta.json.Json;
import jakarta.json.JsonObjectBuilder;

final class AddressJson {
    private AddressJson() {
    }

    static JsonObjectBuilder write(PostalAddress address) {
        var builder = Json.createObjectBuilder();
        if (address.firstName() != null) {
            builder.add("first_name", address.firstName());
        }
        if (address.lastName() != null) {
            builder.add("last_name", address.lastName());
        }
        builder.add("street_address", address.streetAddress())
                .add("address_locality", address.addressLocality());
        if (address.addressRegion() != null) {
            builder.add("address_region", address.addressRegion());
        }
        return builder
                .add("postal_code", address.postalCode())
                .add("address_country", address.addressCountry());
    }
}
