package com.amannmalik.ucp.api.shared;

import com.amannmalik.ucp.util.Ensure;

public final class UcpClientException extends RuntimeException {
    private final UcpError error;

    public UcpClientException(UcpError error) {
        super(Ensure.notNull("error", error).describe(), causeOf(error));
        this.error = error;
    }

    private static Throwable causeOf(UcpError error) {
        if (error instanceof UcpError.NetworkError network) {
            return network.cause();
        }
        if (error instanceof UcpError.DecodeError decode) {
            return decode.cause();
        }
        return null;
    }

    public UcpError error() {
        return error;
    }
}
