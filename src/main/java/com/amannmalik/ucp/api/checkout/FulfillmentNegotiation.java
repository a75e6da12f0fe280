package com.amannmalik.ucp.api.checkout;

import com.amannmalik.ucp.api.checkout.model.CheckoutSession;
import com.amannmalik.ucp.util.Ensure;

/**
 * Where a negotiation stopped and the last session the merchant returned. Stopping before
 * {@link NegotiationPhase#NEGOTIATED} means the merchant offered nothing to choose from.
 */
public record FulfillmentNegotiation(
        NegotiationPhase phase,
        CheckoutSession session,
        String destinationId,
        String optionId) {
    public FulfillmentNegotiation {
        phase = Ensure.notNull("negotiation.phase", phase);
        session = Ensure.notNull("negotiation.session", session);
        if (phase == NegotiationPhase.NEGOTIATED && (destinationId == null || optionId == null)) {
            throw new IllegalArgumentException("negotiation MUST select a destination and an option");
        }
    }

    public boolean isNegotiated() {
        return phase == NegotiationPhase.NEGOTIATED;
    }
}
