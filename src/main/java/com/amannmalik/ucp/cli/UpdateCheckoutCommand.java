package com.amannmalik.ucp.cli;

import com.amannmalik.ucp.tools.CheckoutTools;
import jakarta.json.JsonObject;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(name = "update", description = "Apply discount codes to a checkout session")
public final class UpdateCheckoutCommand extends ToolCommand {
    @CommandLine.Option(names = "--checkout-id", required = true, description = "Checkout session id")
    String checkoutId;
    @CommandLine.Option(names = "--discount-code", split = ",", description = "Discount code(s) to apply")
    List<String> discountCodes;

    public UpdateCheckoutCommand() {
    }

    @Override
    JsonObject invoke(CheckoutTools tools) {
        return tools.updateCheckout(merchantUrl, checkoutId, discountCodes);
    }
}
