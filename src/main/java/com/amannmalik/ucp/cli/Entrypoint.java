package com.amannmalik.ucp.cli;

import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

/**
 * {@code ucp} command line. Each subcommand runs one checkout tool against a merchant and
 * prints its JSON result on stdout; diagnostics go to stderr through the logging backend.
 */
public final class Entrypoint {
    private Entrypoint() {
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    public static CommandLine commandLine() {
        var commandLine = new CommandLine(new RootCommand());
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            cmd.getErr().println("ucp " + cmd.getCommandName() + " failed: " + ex.getMessage());
            cmd.getErr().flush();
            return 1;
        });
        return commandLine;
    }

    @Command(
            name = "ucp",
            description = "Universal Commerce Protocol checkout client",
            mixinStandardHelpOptions = true,
            versionProvider = ManifestVersionProvider.class,
            subcommands = {
                    DiscoverCommand.class,
                    CreateCheckoutCommand.class,
                    UpdateCheckoutCommand.class,
                    FulfillCheckoutCommand.class,
                    CompleteCheckoutCommand.class
            })
    static final class RootCommand implements Runnable {
        @Spec
        private CommandSpec spec;

        RootCommand() {
        }

        @Override
        public void run() {
            throw new ParameterException(spec.commandLine(), "Missing subcommand");
        }
    }

    public static final class ManifestVersionProvider implements IVersionProvider {
        public ManifestVersionProvider() {
        }

        @Override
        public String[] getVersion() {
            var version = Entrypoint.class.getPackage().getImplementationVersion();
            return new String[]{"ucp " + (version == null || version.isBlank() ? "development" : version)};
        }
    }
}
