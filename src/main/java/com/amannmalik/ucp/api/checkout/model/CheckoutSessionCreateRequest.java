package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.api.shared.CurrencyCode;
import com.amannmalik.ucp.util.Ensure;

import java.util.List;

public record CheckoutSessionCreateRequest(
        List<LineItemRequest> lineItems,
        Buyer buyer,
        CurrencyCode currency,
        Payment payment) {
    public CheckoutSessionCreateRequest {
        lineItems = Ensure.immutableList("checkout_session.line_items", lineItems);
        if (lineItems.isEmpty()) {
            throw new IllegalArgumentException("checkout_session.line_items MUST NOT be empty");
        }
        buyer = Ensure.notNull("checkout_session.buyer", buyer);
        currency = currency == null ? CurrencyCode.USD : currency;
        payment = payment == null ? Payment.empty() : payment;
    }
}
