package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;

/**
 * Client side of one fulfillment negotiation round: the method type plus whatever has been
 * selected so far. Written as {@code {methods: [{type, selected_destination_id?, groups?}]}}.
 */
public record FulfillmentRequest(String type, String selectedDestinationId, String selectedOptionId) {
    public FulfillmentRequest {
        type = Ensure.nonBlank("fulfillment.type", type);
        selectedDestinationId = Ensure.nonBlankOrNull("fulfillment.selected_destination_id", selectedDestinationId);
        selectedOptionId = Ensure.nonBlankOrNull("fulfillment.selected_option_id", selectedOptionId);
        if (selectedOptionId != null && selectedDestinationId == null) {
            throw new IllegalArgumentException("fulfillment.selected_option_id requires a selected destination");
        }
    }

    public static FulfillmentRequest shipping() {
        return new FulfillmentRequest(FulfillmentMethod.SHIPPING, null, null);
    }

    public FulfillmentRequest withDestination(String destinationId) {
        return new FulfillmentRequest(type, destinationId, null);
    }

    public FulfillmentRequest withOption(String optionId) {
        return new FulfillmentRequest(type, selectedDestinationId, optionId);
    }
}
