package com.amannmalik.ucp.cli;

import com.amannmalik.ucp.api.checkout.model.Item;
import com.amannmalik.ucp.tools.CheckoutTools;
import jakarta.json.JsonObject;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(name = "create", description = "Create a checkout session")
public final class CreateCheckoutCommand extends ToolCommand {
    @CommandLine.Option(
            names = "--item",
            required = true,
            converter = ItemConverter.class,
            description = "Item to buy as id[:quantity[:title]]. Repeat per item.")
    List<Item> items;
    @CommandLine.Option(names = "--buyer-name", required = true, description = "Full name of the buyer")
    String buyerName;
    @CommandLine.Option(names = "--buyer-email", required = true, description = "Email address of the buyer")
    String buyerEmail;
    @CommandLine.Option(names = "--currency", defaultValue = CheckoutTools.DEFAULT_CURRENCY, description = "Currency code (default: ${DEFAULT-VALUE})")
    String currency;

    public CreateCheckoutCommand() {
    }

    @Override
    JsonObject invoke(CheckoutTools tools) {
        return tools.createCheckout(merchantUrl, items, buyerName, buyerEmail, currency);
    }
}
