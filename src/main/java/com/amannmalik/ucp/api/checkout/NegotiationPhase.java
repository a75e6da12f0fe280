package com.amannmalik.ucp.api.checkout;

/// Fulfillment negotiation states in the order they are reached.
public enum NegotiationPhase {
    START,
    DESTINATION_OFFERED,
    DESTINATION_SELECTED,
    OPTIONS_OFFERED,
    NEGOTIATED
}
