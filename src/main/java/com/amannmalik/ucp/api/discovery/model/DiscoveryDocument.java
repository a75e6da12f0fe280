package com.amannmalik.ucp.api.discovery.model;

import com.amannmalik.ucp.util.Ensure;

import java.util.List;
import java.util.Optional;

/**
 * Merchant profile served from {@code /.well-known/ucp}.
 */
public record DiscoveryDocument(String version, List<Capability> capabilities, List<PaymentHandler> paymentHandlers) {
    public static final String UNKNOWN_VERSION = "unknown";

    public DiscoveryDocument {
        version = version == null || version.isBlank() ? UNKNOWN_VERSION : version;
        capabilities = Ensure.immutableListOrEmpty(capabilities);
        paymentHandlers = Ensure.immutableListOrEmpty(paymentHandlers);
    }

    public boolean supports(String capabilityName) {
        return capabilities.stream().anyMatch(capability -> capability.name().equals(capabilityName));
    }

    public Optional<PaymentHandler> handler(String handlerId) {
        return paymentHandlers.stream().filter(handler -> handler.id().equals(handlerId)).findFirst();
    }
}
