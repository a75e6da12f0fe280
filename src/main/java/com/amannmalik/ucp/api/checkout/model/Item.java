package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;

/**
 * A product the caller wants in the cart, before the merchant has priced it.
 */
public record Item(String id, String title, int quantity) {
    public Item {
        id = Ensure.nonBlank("item.id", id);
        title = title == null ? "" : title;
        quantity = Ensure.positiveInt("item.quantity", quantity);
    }

    public Item(String id, int quantity) {
        this(id, "", quantity);
    }
}
