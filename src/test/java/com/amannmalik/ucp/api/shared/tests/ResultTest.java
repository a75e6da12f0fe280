package com.amannmalik.ucp.api.shared.tests;

import com.amannmalik.ucp.api.shared.Result;
import com.amannmalik.ucp.api.shared.UcpClientException;
import com.amannmalik.ucp.api.shared.UcpError;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

final class ResultTest {
    @Test
    void failureSkipsMappingAndKeepsItsError() {
        var error = new UcpError.ProtocolHttpError(404, "{\"detail\":\"Not Found\"}");
        Result<Integer> failed = Result.failure(error);

        var mapped = failed.map(value -> value + 1).flatMap(value -> Result.success("unreachable"));

        assertTrue(mapped.isFailure());
        assertSame(error, mapped.error().orElseThrow());
        assertTrue(mapped.toOptional().isEmpty());
    }

    @Test
    void recoverReplacesOnlyFailures() {
        Result<String> failed = Result.failure(new UcpError.NetworkError("connection refused", null));
        var seen = new AtomicReference<UcpError>();

        var recovered = failed.onFailure(seen::set).recover(error -> "fallback");

        assertEquals("fallback", recovered.orElseThrow());
        assertInstanceOf(UcpError.NetworkError.class, seen.get());
        assertEquals("kept", Result.success("kept").recover(error -> "fallback").orElseThrow());
    }

    @Test
    void orElseThrowCarriesTheError() {
        var error = new UcpError.DecodeError("expected JSON object but got ARRAY", null);

        var thrown = assertThrows(UcpClientException.class, () -> Result.failure(error).orElseThrow());

        assertSame(error, thrown.error());
    }

    @Test
    void errorsDescribeThemselvesForAgents() {
        assertEquals("Could not connect to merchant: connection refused",
                new UcpError.NetworkError("connection refused", null).describe());
        assertEquals("HTTP error from merchant: 404 - missing",
                new UcpError.ProtocolHttpError(404, "missing").describe());
        assertEquals("HTTP 500", new UcpError.ProtocolHttpError(500, null).message());
        assertEquals("Malformed response from merchant: bad", new UcpError.DecodeError("bad", null).describe());
        assertTrue(new UcpError.ClientMisuseError("closed").describe().startsWith("Client not initialized"));
    }
}
