package com.amannmalik.ucp.api.checkout;

import com.amannmalik.ucp.api.checkout.model.*;
import com.amannmalik.ucp.api.shared.CurrencyCode;
import com.amannmalik.ucp.api.shared.Result;
import com.amannmalik.ucp.util.Ensure;
import jakarta.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Purchase flow over one merchant: create, optionally negotiate fulfillment, update, complete.
 * Holds no session state between calls and retries nothing; any failure is returned as-is.
 */
public final class CheckoutSessionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CheckoutSessionOrchestrator.class);

    private final CheckoutSessionApi api;
    private final CheckoutSessionUpdateMerger merger;
    private final FulfillmentNegotiator negotiator;
    private final Supplier<String> instrumentIdSupplier;
    private final PostalAddress billingAddress;
    private final RiskSignals riskSignals;

    public CheckoutSessionOrchestrator(CheckoutSessionApi api) {
        this(api, CheckoutSessionOrchestrator::defaultInstrumentId, PostalAddress.placeholder(), RiskSignals.agentDefaults());
    }

    public CheckoutSessionOrchestrator(
            CheckoutSessionApi api,
            Supplier<String> instrumentIdSupplier,
            PostalAddress billingAddress,
            RiskSignals riskSignals) {
        this.api = Ensure.notNull("orchestrator.api", api);
        this.merger = new CheckoutSessionUpdateMerger(api);
        this.negotiator = new FulfillmentNegotiator(merger);
        this.instrumentIdSupplier =
                Objects.requireNonNullElse(instrumentIdSupplier, CheckoutSessionOrchestrator::defaultInstrumentId);
        this.billingAddress = billingAddress == null ? PostalAddress.placeholder() : billingAddress;
        this.riskSignals = riskSignals == null ? RiskSignals.agentDefaults() : riskSignals;
    }

    private static String defaultInstrumentId() {
        return "instr_" + UUID.randomUUID();
    }

    public Result<CheckoutSession> create(List<Item> items, Buyer buyer, CurrencyCode currency) {
        return create(items, buyer, currency, List.of());
    }

    public Result<CheckoutSession> create(
            List<Item> items, Buyer buyer, CurrencyCode currency, List<JsonObject> paymentHandlers) {
        var lineItems = Ensure.immutableList("items", items).stream().map(LineItemRequest::of).toList();
        var request = new CheckoutSessionCreateRequest(
                lineItems, buyer, currency, new Payment(List.of(), paymentHandlers));
        return api.create(request)
                .map(session -> {
                    log.info("Created checkout session {} with {} line item(s), status {}",
                            session.id(), session.lineItems().size(), session.status());
                    return session;
                });
    }

    public Result<CheckoutSession> retrieve(CheckoutSessionId id) {
        return api.retrieve(Ensure.notNull("checkout_session.id", id));
    }

    /// Runs the full negotiation and reports the phase it stopped at.
    public Result<FulfillmentNegotiation> negotiate(CheckoutSessionId id) {
        return negotiator.negotiate(id);
    }

    public Result<CheckoutSession> negotiateFulfillment(CheckoutSessionId id) {
        return negotiate(id).map(FulfillmentNegotiation::session);
    }

    /**
     * Applies discount codes and/or replaces line items. {@code null} leaves the respective part
     * untouched; everything else is carried forward from the session as currently stored.
     */
    public Result<CheckoutSession> update(
            CheckoutSessionId id, List<String> discountCodes, List<LineItemRequest> lineItems) {
        Ensure.notNull("checkout_session.id", id);
        return merger.apply(id, new CheckoutChange(discountCodes, lineItems, null));
    }

    public Result<CheckoutSession> complete(CheckoutSessionId id, String handlerId, CardDetails card) {
        return complete(id, handlerId, handlerId, card);
    }

    public Result<CheckoutSession> complete(
            CheckoutSessionId id, String handlerId, String handlerName, CardDetails card) {
        Ensure.notNull("checkout_session.id", id);
        var paymentData = new PaymentData(instrumentIdSupplier.get(), handlerId, handlerName, card, billingAddress);
        return api.complete(id, new CheckoutSessionCompleteRequest(paymentData, riskSignals))
                .map(session -> {
                    if (session.status().isComplete()) {
                        log.info("Checkout session {} complete, order {}",
                                session.id(), session.orderReceipt().map(Order::id).orElse("<none>"));
                    } else {
                        log.info("Checkout session {} submitted for completion, status {}", session.id(), session.status());
                    }
                    return session;
                });
    }
}
