package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;

public record PaymentData(
        String id,
        String handlerId,
        String handlerName,
        CardDetails card,
        PostalAddress billingAddress) {
    public static final String TYPE_CARD = "card";
    public static final String CREDENTIAL_TYPE_TOKEN = "token";

    public PaymentData {
        id = Ensure.nonBlank("payment_data.id", id);
        handlerId = Ensure.nonBlank("payment_data.handler_id", handlerId);
        handlerName = Ensure.nonBlank("payment_data.handler_name", handlerName);
        card = Ensure.notNull("payment_data.card", card);
        billingAddress = Ensure.notNull("payment_data.billing_address", billingAddress);
    }
}
