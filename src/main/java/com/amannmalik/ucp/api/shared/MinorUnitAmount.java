package com.amannmalik.ucp.api.shared;

/**
 * Whole amount in the currency's minor unit (cents for USD), exactly as the merchant reports it.
 * Discount totals arrive as positive amounts; no sign conventions are applied here.
 */
public record MinorUnitAmount(long value) {
    private static final long LIMIT = 9_000_000_000_000L;
    private static final MinorUnitAmount ZERO = new MinorUnitAmount(0L);

    public MinorUnitAmount {
        if (value > LIMIT || value < -LIMIT) {
            throw new IllegalArgumentException("amount MUST be within +/-" + LIMIT + " minor units");
        }
    }

    /// Used for totals the merchant sent without an amount.
    public static MinorUnitAmount zero() {
        return ZERO;
    }
}
