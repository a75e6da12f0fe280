package com.amannmalik.ucp.cli;

import com.amannmalik.ucp.client.HmacRequestSigner;
import com.amannmalik.ucp.client.TransportConfiguration;
import picocli.CommandLine;

import java.net.URI;
import java.time.Duration;
import java.util.Base64;

/// Transport options shared by every subcommand.
public final class ClientOptions {
    @CommandLine.Option(
            names = "--timeout",
            defaultValue = "PT30S",
            description = "Per-request timeout (ISO-8601). Default: ${DEFAULT-VALUE}")
    Duration timeout;
    @CommandLine.Option(
            names = "--agent-profile",
            description = "Agent profile URI sent in the UCP-Agent header")
    URI agentProfile;
    @CommandLine.Option(
            names = "--signature-key",
            description = "Request signing key in the form keyId=base64urlSecret (default: unsigned placeholder)")
    String signatureKey;

    public ClientOptions() {
    }

    private static byte[] decodeSecret(String encoded) {
        try {
            return Base64.getUrlDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Signature key MUST be base64url encoded", e);
        }
    }

    TransportConfiguration configuration() {
        var configuration = TransportConfiguration.defaults();
        if (timeout != null) {
            configuration = configuration.withRequestTimeout(timeout);
        }
        if (agentProfile != null) {
            configuration = configuration.withAgentProfile(agentProfile);
        }
        if (signatureKey != null) {
            var parts = signatureKey.split("=", 2);
            if (parts.length != 2 || parts[0].isBlank()) {
                throw new IllegalArgumentException("Invalid signature key format: expected keyId=base64urlSecret");
            }
            configuration = configuration.withSigner(new HmacRequestSigner(parts[0], decodeSecret(parts[1])));
        }
        return configuration;
    }
}
