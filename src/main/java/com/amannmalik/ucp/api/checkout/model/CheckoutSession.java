package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.api.shared.CurrencyCode;
import com.amannmalik.ucp.util.Ensure;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of a merchant-held checkout session. The merchant owns all arithmetic; amounts are
 * looked up from {@link #totals()}, never recomputed here.
 */
public record CheckoutSession(
        CheckoutSessionId id,
        CheckoutSessionStatus status,
        CurrencyCode currency,
        List<LineItem> lineItems,
        List<Total> totals,
        Discounts discounts,
        Fulfillment fulfillment,
        Payment payment,
        Buyer buyer,
        Order order) {
    public CheckoutSession {
        id = Ensure.notNull("checkout_session.id", id);
        status = Ensure.notNull("checkout_session.status", status);
        // Optional fields may remain null intentionally.
        lineItems = Ensure.immutableListOrEmpty(lineItems);
        totals = Ensure.immutableListOrEmpty(totals);
        discounts = discounts == null ? Discounts.none() : discounts;
    }

    /// Stand-in used when the current state could not be fetched before an update.
    public static CheckoutSession empty(CheckoutSessionId id) {
        return new CheckoutSession(
                id, CheckoutSessionStatus.INCOMPLETE, null, List.of(), List.of(), Discounts.none(), null, null, null, null);
    }

    public long total() {
        return amountOf(Total.TOTAL);
    }

    public long subtotal() {
        return amountOf(Total.SUBTOTAL);
    }

    public long discountAmount() {
        return amountOf(Total.DISCOUNT);
    }

    /// First entry of the given type wins; absent types read as zero.
    public long amountOf(String type) {
        return totalOf(type).map(total -> total.amount().value()).orElse(0L);
    }

    public Optional<Total> totalOf(String type) {
        return totals.stream().filter(total -> total.hasType(type)).findFirst();
    }

    public Optional<Fulfillment> fulfillmentState() {
        return Optional.ofNullable(fulfillment);
    }

    public Optional<Order> orderReceipt() {
        return Optional.ofNullable(order);
    }
}
