package com.amannmalik.ucp.cli;

import com.amannmalik.ucp.api.checkout.model.CardDetails;
import com.amannmalik.ucp.tools.CheckoutTools;
import jakarta.json.JsonObject;
import picocli.CommandLine;

@CommandLine.Command(name = "complete", description = "Submit payment and complete a checkout session")
public final class CompleteCheckoutCommand extends ToolCommand {
    @CommandLine.Option(names = "--checkout-id", required = true, description = "Checkout session id")
    String checkoutId;
    @CommandLine.Option(
            names = "--handler-id",
            defaultValue = CheckoutTools.DEFAULT_PAYMENT_HANDLER_ID,
            description = "Payment handler id from discover (default: ${DEFAULT-VALUE})")
    String handlerId;
    @CommandLine.Option(names = "--card-token", defaultValue = CheckoutTools.DEFAULT_CARD_TOKEN, description = "Payment credential token")
    String cardToken;
    @CommandLine.Option(names = "--card-brand", defaultValue = CheckoutTools.DEFAULT_CARD_BRAND, description = "Card brand (default: ${DEFAULT-VALUE})")
    String cardBrand;
    @CommandLine.Option(
            names = "--card-last-digits",
            defaultValue = CheckoutTools.DEFAULT_CARD_LAST_DIGITS,
            description = "Last four card digits (default: ${DEFAULT-VALUE})")
    String cardLastDigits;

    public CompleteCheckoutCommand() {
    }

    @Override
    JsonObject invoke(CheckoutTools tools) {
        CardDetails card;
        try {
            card = new CardDetails(cardBrand, cardLastDigits, cardToken);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
        return tools.completeCheckout(merchantUrl, checkoutId, handlerId, card);
    }
}
