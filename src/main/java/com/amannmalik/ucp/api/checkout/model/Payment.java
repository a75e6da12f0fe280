package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;
import jakarta.json.JsonObject;

import java.util.List;

/**
 * Session payment block. Instruments and handlers are echoed back to the merchant verbatim
 * on every update, so they stay as raw JSON.
 */
public record Payment(List<JsonObject> instruments, List<JsonObject> handlers) {
    private static final Payment EMPTY = new Payment(List.of(), List.of());

    public Payment {
        instruments = Ensure.immutableListOrEmpty(instruments);
        handlers = Ensure.immutableListOrEmpty(handlers);
    }

    public static Payment empty() {
        return EMPTY;
    }
}
