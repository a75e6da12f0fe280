package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;
import jakarta.json.JsonObject;

/**
 * A candidate shipping destination offered by the merchant. Address fields are merchant
 * shaped and kept as received.
 */
public record FulfillmentDestination(String id, JsonObject address) {
    public FulfillmentDestination {
        id = Ensure.nonBlank("fulfillment_destination.id", id);
        address = Ensure.notNull("fulfillment_destination.address", address);
    }
}
