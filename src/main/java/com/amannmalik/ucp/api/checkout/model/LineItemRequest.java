package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;
import jakarta.json.Json;
import jakarta.json.JsonObject;

public record LineItemRequest(String id, JsonObject item, int quantity) {
    public LineItemRequest {
        id = Ensure.nonBlankOrNull("line_item.id", id);
        item = Ensure.notNull("line_item.item", item);
        quantity = Ensure.positiveInt("line_item.quantity", quantity);
    }

    public static LineItemRequest of(Item item) {
        var descriptor = Json.createObjectBuilder()
                .add("id", item.id())
                .add("title", item.title())
                .build();
        return new LineItemRequest(null, descriptor, item.quantity());
    }
}
