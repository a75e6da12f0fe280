package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.api.shared.CurrencyCode;
import com.amannmalik.ucp.util.Ensure;

import java.util.List;

/**
 * Full-resource body for {@code PUT /checkout-sessions/{id}}. The endpoint treats omitted
 * required fields as cleared, so currency and payment are always present.
 * A {@code null} line item list, discount code list or fulfillment request is omitted from the wire.
 */
public record CheckoutSessionUpdateRequest(
        CheckoutSessionId id,
        List<LineItemRequest> lineItems,
        CurrencyCode currency,
        Payment payment,
        List<String> discountCodes,
        FulfillmentRequest fulfillment) {
    public CheckoutSessionUpdateRequest {
        id = Ensure.notNull("checkout_session.id", id);
        lineItems = lineItems == null ? null : List.copyOf(lineItems);
        currency = Ensure.notNull("checkout_session.currency", currency);
        payment = Ensure.notNull("checkout_session.payment", payment);
        discountCodes = discountCodes == null ? null : List.copyOf(discountCodes);
    }
}
