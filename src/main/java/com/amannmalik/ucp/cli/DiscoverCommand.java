package com.amannmalik.ucp.cli;

import com.amannmalik.ucp.tools.CheckoutTools;
import jakarta.json.JsonObject;
import picocli.CommandLine;

@CommandLine.Command(name = "discover", description = "Show a merchant's UCP capabilities and payment handlers")
public final class DiscoverCommand extends ToolCommand {
    public DiscoverCommand() {
    }

    @Override
    JsonObject invoke(CheckoutTools tools) {
        return tools.discover(merchantUrl);
    }
}
