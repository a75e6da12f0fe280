package com.amannmalik.ucp.api.checkout;

import com.amannmalik.ucp.api.checkout.model.*;
import com.amannmalik.ucp.api.shared.CurrencyCode;
import com.amannmalik.ucp.api.shared.Result;
import com.amannmalik.ucp.util.Ensure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns a partial change into the full resource body the update endpoint requires.
 *
 * <p>The endpoint is not a PATCH: omitted required fields are read as "clear". Each update
 * therefore reads the current session, merges the change over it and writes the whole
 * resource back. Anything written to the session by someone else between the read and the
 * write is overwritten; the protocol exposes no version token to detect that.
 */
public final class CheckoutSessionUpdateMerger {
    private static final Logger log = LoggerFactory.getLogger(CheckoutSessionUpdateMerger.class);

    private final CheckoutSessionApi api;

    public CheckoutSessionUpdateMerger(CheckoutSessionApi api) {
        this.api = Ensure.notNull("merger.api", api);
    }

    /**
     * Pure merge step. {@code snapshot} is the last known state of the session; callers that
     * have none pass {@link CheckoutSession#empty(CheckoutSessionId)}.
     */
    public static CheckoutSessionUpdateRequest merge(
            CheckoutSessionId id, CheckoutSession snapshot, CheckoutChange change) {
        Ensure.notNull("checkout_session.id", id);
        Ensure.notNull("snapshot", snapshot);
        Ensure.notNull("change", change);
        return new CheckoutSessionUpdateRequest(
                id,
                mergeLineItems(snapshot, change),
                snapshot.currency() != null ? snapshot.currency() : CurrencyCode.USD,
                snapshot.payment() != null ? snapshot.payment() : Payment.empty(),
                change.discountCodes(),
                change.fulfillment());
    }

    private static List<LineItemRequest> mergeLineItems(CheckoutSession snapshot, CheckoutChange change) {
        if (change.lineItems() != null) {
            return change.lineItems();
        }
        if (snapshot.lineItems().isEmpty()) {
            return null;
        }
        return snapshot.lineItems().stream().map(LineItem::toRequest).toList();
    }

    /**
     * Reads the current session. A failed read is not fatal: the update proceeds from an
     * empty snapshot and the merchant rejects it if required fields are really missing.
     */
    public CheckoutSession fetchSnapshot(CheckoutSessionId id) {
        return api.retrieve(id)
                .onFailure(error -> log.warn(
                        "Could not read checkout session {} before update, continuing without a snapshot: {}",
                        id, error.describe()))
                .recover(error -> CheckoutSession.empty(id))
                .orElseThrow();
    }

    /// Merges {@code change} over {@code base} and writes the result.
    public Result<CheckoutSession> submit(CheckoutSessionId id, CheckoutSession base, CheckoutChange change) {
        var request = merge(id, base, change);
        log.debug("Updating checkout session {} (line_items={}, discounts={}, fulfillment={})",
                id,
                request.lineItems() == null ? "omitted" : request.lineItems().size(),
                request.discountCodes() == null ? "omitted" : request.discountCodes(),
                request.fulfillment());
        return api.update(request);
    }

    /// Read, merge, write.
    public Result<CheckoutSession> apply(CheckoutSessionId id, CheckoutChange change) {
        return submit(id, fetchSnapshot(id), change);
    }
}
