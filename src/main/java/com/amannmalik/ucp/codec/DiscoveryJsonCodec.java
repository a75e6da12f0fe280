package com.amannmalik.ucp.codec;

import com.amannmalik.ucp.api.discovery.model.Capability;
import com.amannmalik.ucp.api.discovery.model.DiscoveryDocument;
import com.amannmalik.ucp.api.discovery.model.PaymentHandler;
import jakarta.json.JsonObject;
import jakarta.json.JsonValue;

/// Reads the merchant profile at `/.well-known/ucp`.
public final class DiscoveryJsonCodec {
    public DiscoveryJsonCodec() {
    }

    private static Capability mapCapability(JsonObject object) {
        return new Capability(
                JsonSupport.requireString(object, "name"),
                JsonSupport.requireString(object, "version"),
                JsonSupport.optionalUri(object, "spec"),
                JsonSupport.optionalUri(object, "schema"),
                JsonSupport.optionalString(object, "extends"));
    }

    private static PaymentHandler mapPaymentHandler(JsonObject object) {
        return new PaymentHandler(
                JsonSupport.requireString(object, "id"),
                JsonSupport.requireString(object, "name"),
                JsonSupport.requireString(object, "version"),
                JsonSupport.optionalUri(object, "spec"),
                JsonSupport.optionalObject(object, "config"));
    }

    public DiscoveryDocument readDiscoveryDocument(JsonObject root) {
        var ucp = JsonSupport.optionalObject(root, "ucp");
        var payment = JsonSupport.optionalObject(root, "payment");
        if (ucp == null) {
            ucp = JsonValue.EMPTY_JSON_OBJECT;
        }
        if (payment == null) {
            payment = JsonValue.EMPTY_JSON_OBJECT;
        }
        try {
            return new DiscoveryDocument(
                    JsonSupport.optionalString(ucp, "version"),
                    JsonSupport.mapObjects(ucp, "capabilities", DiscoveryJsonCodec::mapCapability),
                    JsonSupport.mapObjects(payment, "handlers", DiscoveryJsonCodec::mapPaymentHandler));
        } catch (IllegalArgumentException e) {
            throw new JsonDecodingException(e.getMessage(), e);
        }
    }
}
