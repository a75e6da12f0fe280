package com.amannmalik.ucp.client;

import com.amannmalik.ucp.util.Ensure;

import java.net.URI;
import java.time.Duration;

/**
 * Per-client transport settings. The request timeout applies to each HTTP exchange on its
 * own, not to a whole multi-request operation.
 */
public record TransportConfiguration(
        Duration requestTimeout,
        Duration connectTimeout,
        URI agentProfile,
        RequestSigner signer) {
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final URI DEFAULT_AGENT_PROFILE = URI.create("https://ucp-agent.example/profile");

    public TransportConfiguration {
        requestTimeout = positive("transport.request_timeout", requestTimeout);
        connectTimeout = positive("transport.connect_timeout", connectTimeout);
        agentProfile = Ensure.notNull("transport.agent_profile", agentProfile);
        signer = Ensure.notNull("transport.signer", signer);
    }

    public static TransportConfiguration defaults() {
        return new TransportConfiguration(
                DEFAULT_REQUEST_TIMEOUT, DEFAULT_CONNECT_TIMEOUT, DEFAULT_AGENT_PROFILE, StaticRequestSigner.placeholder());
    }

    private static Duration positive(String field, Duration value) {
        Ensure.notNull(field, value);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(field + " MUST be positive");
        }
        return value;
    }

    public TransportConfiguration withRequestTimeout(Duration timeout) {
        return new TransportConfiguration(timeout, connectTimeout, agentProfile, signer);
    }

    public TransportConfiguration withAgentProfile(URI profile) {
        return new TransportConfiguration(requestTimeout, connectTimeout, profile, signer);
    }

    public TransportConfiguration withSigner(RequestSigner requestSigner) {
        return new TransportConfiguration(requestTimeout, connectTimeout, agentProfile, requestSigner);
    }

    /// Value of the {@code UCP-Agent} header.
    public String agentHeader() {
        return "profile=\"" + agentProfile + "\"";
    }
}
