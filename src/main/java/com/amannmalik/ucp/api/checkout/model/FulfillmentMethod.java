package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;

import java.util.List;
import java.util.Optional;

public record FulfillmentMethod(
        String id,
        String type,
        List<String> lineItemIds,
        List<FulfillmentDestination> destinations,
        String selectedDestinationId,
        List<FulfillmentGroup> groups) {
    public static final String SHIPPING = "shipping";

    public FulfillmentMethod {
        id = Ensure.nonBlankOrNull("fulfillment_method.id", id);
        type = Ensure.nonBlank("fulfillment_method.type", type);
        lineItemIds = Ensure.immutableListOrEmpty(lineItemIds);
        destinations = Ensure.immutableListOrEmpty(destinations);
        selectedDestinationId = Ensure.nonBlankOrNull(
                "fulfillment_method.selected_destination_id", selectedDestinationId);
        groups = Ensure.immutableListOrEmpty(groups);
    }

    public Optional<FulfillmentDestination> firstDestination() {
        return destinations.stream().findFirst();
    }
}
