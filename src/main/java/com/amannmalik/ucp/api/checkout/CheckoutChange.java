package com.amannmalik.ucp.api.checkout;

import com.amannmalik.ucp.api.checkout.model.FulfillmentRequest;
import com.amannmalik.ucp.api.checkout.model.LineItemRequest;

import java.util.List;

/**
 * The part of a session the caller means to change. {@code null} means "leave as the merchant
 * has it"; an empty discount code list is sent as-is and clears the requested codes.
 */
public record CheckoutChange(List<String> discountCodes, List<LineItemRequest> lineItems, FulfillmentRequest fulfillment) {
    public CheckoutChange {
        discountCodes = discountCodes == null ? null : List.copyOf(discountCodes);
        lineItems = lineItems == null || lineItems.isEmpty() ? null : List.copyOf(lineItems);
    }

    public static CheckoutChange discountCodes(List<String> codes) {
        return new CheckoutChange(codes, null, null);
    }

    public static CheckoutChange lineItems(List<LineItemRequest> lineItems) {
        return new CheckoutChange(null, lineItems, null);
    }

    public static CheckoutChange fulfillment(FulfillmentRequest fulfillment) {
        return new CheckoutChange(null, null, fulfillment);
    }
}
