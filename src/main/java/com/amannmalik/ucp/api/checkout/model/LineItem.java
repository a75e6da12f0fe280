package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;
import jakarta.json.JsonObject;
import jakarta.json.JsonString;

import java.util.List;

/**
 * One priced line of a session. The item descriptor is merchant-defined and kept verbatim.
 */
public record LineItem(String id, JsonObject item, int quantity, List<Total> totals) {
    public LineItem {
        id = Ensure.nonBlankOrNull("line_item.id", id);
        item = Ensure.notNull("line_item.item", item);
        quantity = Ensure.positiveInt("line_item.quantity", quantity);
        totals = Ensure.immutableListOrEmpty(totals);
    }

    public String itemId() {
        return stringField("id");
    }

    public String itemTitle() {
        return stringField("title");
    }

    /// Request form used when the line is resent unchanged; server-computed totals are dropped.
    public LineItemRequest toRequest() {
        return new LineItemRequest(id, item, quantity);
    }

    private String stringField(String key) {
        var value = item.get(key);
        return value instanceof JsonString string ? string.getString() : null;
    }
}
