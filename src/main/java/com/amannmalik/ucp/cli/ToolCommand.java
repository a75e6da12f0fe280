package com.amannmalik.ucp.cli;

import com.amannmalik.ucp.tools.CheckoutTools;
import jakarta.json.JsonObject;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;

import java.util.concurrent.Callable;

/**
 * Runs one {@link CheckoutTools} operation and prints its JSON result. Exit code 1 signals
 * that the result carries an {@code error}.
 */
abstract class ToolCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandSpec spec;
    @CommandLine.Mixin
    ClientOptions clientOptions;
    @CommandLine.Option(names = "--merchant", required = true, description = "Merchant base URL, e.g. http://localhost:8182")
    String merchantUrl;

    abstract JsonObject invoke(CheckoutTools tools);

    @Override
    public Integer call() {
        CheckoutTools tools;
        try {
            tools = new CheckoutTools(clientOptions.configuration());
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
        var result = invoke(tools);
        spec.commandLine().getOut().println(result);
        spec.commandLine().getOut().flush();
        return result.containsKey("error") ? 1 : 0;
    }
}
