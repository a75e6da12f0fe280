package com.amannmalik.ucp.api.checkout;

import com.amannmalik.ucp.api.checkout.model.*;
import com.amannmalik.ucp.api.shared.Result;
import com.amannmalik.ucp.util.Ensure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Drives shipping selection to completion by round-tripping the update endpoint:
 * request shipping, pick a destination, pick an option. Always the first offer is taken.
 *
 * <p>Every round merges over the session returned by the previous round, since the
 * merchant may have changed line items or payment along the way.
 */
public final class FulfillmentNegotiator {
    private static final Logger log = LoggerFactory.getLogger(FulfillmentNegotiator.class);

    private final CheckoutSessionUpdateMerger merger;

    public FulfillmentNegotiator(CheckoutSessionApi api) {
        this(new CheckoutSessionUpdateMerger(api));
    }

    public FulfillmentNegotiator(CheckoutSessionUpdateMerger merger) {
        this.merger = Ensure.notNull("negotiator.merger", merger);
    }

    private static Stream<FulfillmentMethod> methods(CheckoutSession session) {
        return session.fulfillmentState().stream().flatMap(fulfillment -> fulfillment.methods().stream());
    }

    private static Optional<FulfillmentOption> firstOption(FulfillmentMethod method) {
        return method.groups().stream().flatMap(group -> group.options().stream()).findFirst();
    }

    /// First method, in merchant order, that offers at least one destination.
    public static Optional<FulfillmentMethod> selectMethod(CheckoutSession session) {
        return methods(session).filter(method -> !method.destinations().isEmpty()).findFirst();
    }

    public static Optional<String> selectDestination(CheckoutSession session) {
        return selectMethod(session)
                .flatMap(FulfillmentMethod::firstDestination)
                .map(FulfillmentDestination::id);
    }

    /// First option of any method.
    public static Optional<String> selectOption(CheckoutSession session) {
        return methods(session).flatMap(method -> firstOption(method).stream()).findFirst().map(FulfillmentOption::id);
    }

    /**
     * First option offered by the method the destination was chosen on. The method is matched
     * by its selected destination, then by the destinations it lists; when no method mentions
     * the destination any more, the first option of any method is taken.
     */
    public static Optional<String> selectOption(CheckoutSession session, String destinationId) {
        var method = methods(session)
                .filter(candidate -> destinationId.equals(candidate.selectedDestinationId()))
                .findFirst()
                .or(() -> methods(session)
                        .filter(candidate -> candidate.destinations().stream()
                                .anyMatch(destination -> destination.id().equals(destinationId)))
                        .findFirst());
        if (method.isEmpty()) {
            return selectOption(session);
        }
        return firstOption(method.get()).map(FulfillmentOption::id);
    }

    public Result<FulfillmentNegotiation> negotiate(CheckoutSessionId id) {
        Ensure.notNull("checkout_session.id", id);
        var request = FulfillmentRequest.shipping();
        var snapshot = merger.fetchSnapshot(id);
        log.debug("Checkout session {}: {} -> requesting {}", id, NegotiationPhase.START, request.type());
        return merger.submit(id, snapshot, CheckoutChange.fulfillment(request))
                .flatMap(offered -> chooseDestination(id, offered));
    }

    private Result<FulfillmentNegotiation> chooseDestination(CheckoutSessionId id, CheckoutSession offered) {
        var method = selectMethod(offered);
        var destination = method.flatMap(FulfillmentMethod::firstDestination).map(FulfillmentDestination::id);
        if (destination.isEmpty()) {
            log.info("Checkout session {}: no fulfillment destinations offered, skipping fulfillment", id);
            return Result.success(new FulfillmentNegotiation(NegotiationPhase.DESTINATION_OFFERED, offered, null, null));
        }
        var selection = new FulfillmentRequest(method.get().type(), destination.get(), null);
        log.debug("Checkout session {}: {} -> selecting destination {}",
                id, NegotiationPhase.DESTINATION_OFFERED, destination.get());
        return merger.submit(id, offered, CheckoutChange.fulfillment(selection))
                .flatMap(selected -> chooseOption(id, selection, selected));
    }

    private Result<FulfillmentNegotiation> chooseOption(
            CheckoutSessionId id, FulfillmentRequest selection, CheckoutSession selected) {
        var option = selectOption(selected, selection.selectedDestinationId());
        if (option.isEmpty()) {
            log.info("Checkout session {}: no fulfillment options offered for destination {}",
                    id, selection.selectedDestinationId());
            return Result.success(new FulfillmentNegotiation(
                    NegotiationPhase.DESTINATION_SELECTED, selected, selection.selectedDestinationId(), null));
        }
        var finalSelection = selection.withOption(option.get());
        log.debug("Checkout session {}: {} -> selecting option {}",
                id, NegotiationPhase.OPTIONS_OFFERED, option.get());
        return merger.submit(id, selected, CheckoutChange.fulfillment(finalSelection))
                .map(negotiated -> {
                    log.info("Checkout session {}: fulfillment negotiated (destination={}, option={})",
                            id, finalSelection.selectedDestinationId(), finalSelection.selectedOptionId());
                    return new FulfillmentNegotiation(
                            NegotiationPhase.NEGOTIATED,
                            negotiated,
                            finalSelection.selectedDestinationId(),
                            finalSelection.selectedOptionId());
                });
    }
}
