package com.amannmalik.ucp.api.discovery.model;

import com.amannmalik.ucp.util.Ensure;
import jakarta.json.JsonObject;
import jakarta.json.JsonValue;

import java.net.URI;

public record PaymentHandler(String id, String name, String version, URI spec, JsonObject config) {
    public PaymentHandler {
        id = Ensure.nonBlank("payment_handler.id", id);
        name = Ensure.nonBlank("payment_handler.name", name);
        version = Ensure.nonBlank("payment_handler.version", version);
        config = config == null ? JsonValue.EMPTY_JSON_OBJECT : config;
    }
}
