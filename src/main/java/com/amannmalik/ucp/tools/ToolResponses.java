package com.amannmalik.ucp.tools;

import com.amannmalik.ucp.api.checkout.FulfillmentNegotiation;
import com.amannmalik.ucp.api.checkout.model.CheckoutSession;
import com.amannmalik.ucp.api.discovery.model.DiscoveryDocument;
import com.amannmalik.ucp.codec.CheckoutSessionJsonCodec;
import jakarta.json.Json;
import jakarta.json.JsonObject;
import jakarta.json.JsonObjectBuilder;
import jakarta.json.JsonValue;

import java.util.Locale;

/// Agent-facing result shapes. Keys are stable; agents key off them.
final class ToolResponses {
    static final String ERROR = "error";

    private static final CheckoutSessionJsonCodec CODEC = new CheckoutSessionJsonCodec();

    private ToolResponses() {
    }

    private static JsonObjectBuilder addNullable(JsonObjectBuilder builder, String key, Object value) {
        return value == null ? builder.addNull(key) : builder.add(key, value.toString());
    }

    private static JsonObjectBuilder sessionHeader(CheckoutSession session) {
        return Json.createObjectBuilder()
                .add("checkout_id", session.id().value())
                .add("status", session.status().jsonValue())
                .add("total", session.total());
    }

    private static String currency(CheckoutSession session) {
        return session.currency() == null ? "USD" : session.currency().value();
    }

    static JsonObject error(String message) {
        return Json.createObjectBuilder()
                .add(ERROR, message == null || message.isBlank() ? "Unknown error" : message)
                .build();
    }

    static JsonObject discovery(DiscoveryDocument document) {
        var capabilities = Json.createArrayBuilder();
        for (var capability : document.capabilities()) {
            var json = Json.createObjectBuilder()
                    .add("name", capability.name())
                    .add("version", capability.version());
            capabilities.add(addNullable(json, "spec", capability.spec()));
        }
        var handlers = Json.createArrayBuilder();
        for (var handler : document.paymentHandlers()) {
            handlers.add(Json.createObjectBuilder()
                    .add("id", handler.id())
                    .add("name", handler.name())
                    .add("version", handler.version()));
        }
        return Json.createObjectBuilder()
                .add("ucp_version", document.version())
                .add("capabilities", capabilities)
                .add("payment_handlers", handlers)
                .build();
    }

    static JsonObject created(CheckoutSession session) {
        var lineItems = Json.createArrayBuilder();
        for (var lineItem : session.lineItems()) {
            var json = Json.createObjectBuilder();
            addNullable(json, "id", lineItem.itemId());
            addNullable(json, "title", lineItem.itemTitle());
            lineItems.add(json.add("quantity", lineItem.quantity()));
        }
        return sessionHeader(session)
                .add("subtotal", session.subtotal())
                .add("currency", currency(session))
                .add("line_items", lineItems)
                .build();
    }

    static JsonObject updated(CheckoutSession session) {
        return sessionHeader(session)
                .add("subtotal", session.subtotal())
                .add("discount_applied", session.discountAmount())
                .add("currency", currency(session))
                .add("discounts", CODEC.writeDiscounts(session.discounts()))
                .build();
    }

    static JsonObject fulfillment(FulfillmentNegotiation negotiation) {
        var session = negotiation.session();
        var builder = sessionHeader(session)
                .add("currency", currency(session))
                .add("fulfillment_phase", negotiation.phase().name().toLowerCase(Locale.ROOT));
        if (session.fulfillment() == null) {
            builder.add("fulfillment", JsonValue.NULL);
        } else {
            builder.add("fulfillment", CODEC.writeFulfillment(session.fulfillment()));
        }
        return builder.build();
    }

    static JsonObject completed(CheckoutSession session) {
        var builder = sessionHeader(session).add("currency", currency(session));
        session.orderReceipt().ifPresent(order -> {
            builder.add("order_id", order.id());
            if (order.permalinkUrl() != null) {
                builder.add("order_url", order.permalinkUrl().toString());
            }
        });
        return builder.build();
    }
}
