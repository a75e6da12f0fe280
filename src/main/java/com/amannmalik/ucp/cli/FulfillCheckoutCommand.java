package com.amannmalik.ucp.cli;

import com.amannmalik.ucp.tools.CheckoutTools;
import jakarta.json.JsonObject;
import picocli.CommandLine;

@CommandLine.Command(
        name = "fulfill",
        description = "Select the first offered shipping destination and option for a checkout session")
public final class FulfillCheckoutCommand extends ToolCommand {
    @CommandLine.Option(names = "--checkout-id", required = true, description = "Checkout session id")
    String checkoutId;

    public FulfillCheckoutCommand() {
    }

    @Override
    JsonObject invoke(CheckoutTools tools) {
        return tools.setFulfillment(merchantUrl, checkoutId);
    }
}
