package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;

/**
 * Server-decided session status. Merchants may introduce statuses this client has never
 * seen, so the value is kept as an open string rather than a closed enum.
 */
public record CheckoutSessionStatus(String value) {
    public static final CheckoutSessionStatus INCOMPLETE = new CheckoutSessionStatus("incomplete");
    public static final CheckoutSessionStatus REQUIRES_ESCALATION = new CheckoutSessionStatus("requires_escalation");
    public static final CheckoutSessionStatus READY_FOR_COMPLETE = new CheckoutSessionStatus("ready_for_complete");
    public static final CheckoutSessionStatus COMPLETE_IN_PROGRESS = new CheckoutSessionStatus("complete_in_progress");
    public static final CheckoutSessionStatus COMPLETE = new CheckoutSessionStatus("complete");
    public static final CheckoutSessionStatus CANCELED = new CheckoutSessionStatus("canceled");

    public CheckoutSessionStatus {
        value = Ensure.nonBlank("checkout_session.status", value);
    }

    public static CheckoutSessionStatus fromJsonValue(final String value) {
        return new CheckoutSessionStatus(value);
    }

    public String jsonValue() {
        return value;
    }

    public boolean isComplete() {
        return COMPLETE.equals(this);
    }

    public boolean isReadyForComplete() {
        return READY_FOR_COMPLETE.equals(this);
    }

    @Override
    public String toString() {
        return value;
    }
}
