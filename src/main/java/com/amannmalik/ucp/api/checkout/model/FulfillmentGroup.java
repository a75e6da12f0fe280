package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;

import java.util.List;

public record FulfillmentGroup(
        String id,
        List<String> lineItemIds,
        List<FulfillmentOption> options,
        String selectedOptionId) {
    public FulfillmentGroup {
        id = Ensure.nonBlankOrNull("fulfillment_group.id", id);
        lineItemIds = Ensure.immutableListOrEmpty(lineItemIds);
        options = Ensure.immutableListOrEmpty(options);
        selectedOptionId = Ensure.nonBlankOrNull("fulfillment_group.selected_option_id", selectedOptionId);
    }
}
