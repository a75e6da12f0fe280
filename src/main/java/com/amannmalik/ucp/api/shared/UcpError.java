package com.amannmalik.ucp.api.shared;

import com.amannmalik.ucp.util.Ensure;

/**
 * Failure kinds surfaced by the merchant client. Every failed call yields exactly one of these.
 */
public sealed interface UcpError
        permits UcpError.NetworkError, UcpError.ProtocolHttpError, UcpError.DecodeError, UcpError.ClientMisuseError {

    String message();

    /// Message suitable for an end user or an agent transcript.
    String describe();

    /**
     * The merchant could not be reached: DNS, connect, timeout or interrupted wait.
     */
    record NetworkError(String message, Throwable cause) implements UcpError {
        public NetworkError {
            message = Ensure.nonBlank("network_error.message", message);
        }

        @Override
        public String describe() {
            return "Could not connect to merchant: " + message;
        }
    }

    /**
     * The merchant answered with a non-2xx status. The raw body is kept for diagnostics.
     */
    record ProtocolHttpError(int status, String body) implements UcpError {
        public ProtocolHttpError {
            if (status < 100 || status > 599) {
                throw new IllegalArgumentException("protocol_http_error.status MUST be a valid HTTP status");
            }
            body = body == null ? "" : body;
        }

        @Override
        public String message() {
            return "HTTP " + status;
        }

        @Override
        public String describe() {
            return "HTTP error from merchant: " + status + " - " + body;
        }
    }

    /**
     * The merchant answered 2xx but the body did not have the expected shape.
     */
    record DecodeError(String message, Throwable cause) implements UcpError {
        public DecodeError {
            message = Ensure.nonBlank("decode_error.message", message);
        }

        @Override
        public String describe() {
            return "Malformed response from merchant: " + message;
        }
    }

    /**
     * The client was used outside of its open scope.
     */
    record ClientMisuseError(String message) implements UcpError {
        public ClientMisuseError {
            message = Ensure.nonBlank("client_misuse_error.message", message);
        }

        @Override
        public String describe() {
            return "Client not initialized: " + message;
        }
    }
}
