package com.amannmalik.ucp.client.tests;

import com.amannmalik.ucp.api.shared.UcpError;
import com.amannmalik.ucp.client.HttpMethod;
import com.amannmalik.ucp.client.TransportConfiguration;
import com.amannmalik.ucp.client.UcpHttpTransport;
import com.amannmalik.ucp.testutil.FakeMerchantServer;
import jakarta.json.Json;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class UcpHttpTransportTest {
    @Test
    void sendsProtocolHeaders() throws Exception {
        try (var merchant = FakeMerchantServer.start()) {
            merchant.respond("POST", "/checkout-sessions", 201, "{\"id\":\"checkout-123\"}");
            merchant.respond("GET", "/checkout-sessions/checkout-123", 200, "{\"id\":\"checkout-123\"}");
            var configuration = TransportConfiguration.defaults()
                    .withAgentProfile(URI.create("https://agent.example/profile"));

            try (var transport = UcpHttpTransport.open(merchant.baseUri(), configuration)) {
                var body = Json.createObjectBuilder().add("currency", "USD").build();
                assertTrue(transport.send(HttpMethod.POST, "/checkout-sessions", body).isSuccess());
                assertTrue(transport.send(HttpMethod.GET, "/checkout-sessions/checkout-123", null).isSuccess());
            }

            var post = merchant.requests("POST").get(0);
            assertEquals("application/json", post.header("Content-Type"));
            assertEquals("profile=\"https://agent.example/profile\"", post.header("UCP-Agent"));
            assertEquals("test", post.header("request-signature"));
            assertTrue(post.header("request-id").startsWith("req_"));
            assertTrue(post.header("idempotency-key").startsWith("idem_"));
            assertEquals("USD", post.json().getString("currency"));

            var get = merchant.requests("GET").get(0);
            assertNotNull(get.header("request-id"));
            assertNull(get.header("idempotency-key"));
        }
    }

    @Test
    void everyRequestGetsFreshIdentifiers() throws Exception {
        try (var merchant = FakeMerchantServer.start();
                var transport = UcpHttpTransport.open(merchant.baseUri(), TransportConfiguration.defaults())) {
            merchant.respond("POST", "/checkout-sessions", 201, "{}");

            transport.send(HttpMethod.POST, "/checkout-sessions", Json.createObjectBuilder().build());
            transport.send(HttpMethod.POST, "/checkout-sessions", Json.createObjectBuilder().build());

            var requests = merchant.requests("POST");
            assertNotEquals(requests.get(0).header("request-id"), requests.get(1).header("request-id"));
            assertNotEquals(requests.get(0).header("idempotency-key"), requests.get(1).header("idempotency-key"));
        }
    }

    @Test
    void nonSuccessStatusKeepsTheBody() throws Exception {
        try (var merchant = FakeMerchantServer.start();
                var transport = UcpHttpTransport.open(merchant.baseUri(), TransportConfiguration.defaults())) {
            var result = transport.send(HttpMethod.GET, "/checkout-sessions/nonexistent", null);

            var error = assertInstanceOf(UcpError.ProtocolHttpError.class, result.error().orElseThrow());
            assertEquals(404, error.status());
            assertTrue(error.body().contains("Not Found"));
        }
    }

    @Test
    void malformedBodiesAreDecodeErrors() throws Exception {
        try (var merchant = FakeMerchantServer.start();
                var transport = UcpHttpTransport.open(merchant.baseUri(), TransportConfiguration.defaults())) {
            merchant.respond("GET", "/not-json", 200, "not json at all");
            merchant.respond("GET", "/array", 200, "[1,2,3]");

            assertInstanceOf(UcpError.DecodeError.class,
                    transport.send(HttpMethod.GET, "/not-json", null).error().orElseThrow());
            assertInstanceOf(UcpError.DecodeError.class,
                    transport.send(HttpMethod.GET, "/array", null).error().orElseThrow());
        }
    }

    @Test
    void unreachableMerchantIsANetworkError() throws Exception {
        var unreachable = FakeMerchantServer.unreachableUri();
        try (var transport = UcpHttpTransport.open(unreachable, TransportConfiguration.defaults())) {
            var result = transport.send(HttpMethod.GET, "/.well-known/ucp", null);

            assertInstanceOf(UcpError.NetworkError.class, result.error().orElseThrow());
        }
    }

    @Test
    void slowMerchantTimesOut() throws Exception {
        try (var merchant = FakeMerchantServer.start()) {
            merchant.respondAfter(Duration.ofSeconds(1), "GET", "/slow", 200, "{}");
            var configuration = TransportConfiguration.defaults().withRequestTimeout(Duration.ofMillis(200));

            try (var transport = UcpHttpTransport.open(merchant.baseUri(), configuration)) {
                var error = transport.send(HttpMethod.GET, "/slow", null).error().orElseThrow();

                assertInstanceOf(UcpError.NetworkError.class, error);
                assertTrue(error.message().contains("timed out"));
            }
        }
    }

    @Test
    void closedTransportRejectsRequests() throws Exception {
        try (var merchant = FakeMerchantServer.start()) {
            var transport = UcpHttpTransport.open(merchant.baseUri(), TransportConfiguration.defaults());
            transport.close();
            transport.close();

            var result = transport.send(HttpMethod.GET, "/.well-known/ucp", null);

            assertFalse(transport.isOpen());
            assertInstanceOf(UcpError.ClientMisuseError.class, result.error().orElseThrow());
            assertTrue(merchant.requests().isEmpty());
        }
    }

    @Test
    void merchantUrlMustBeHttp() {
        assertThrows(IllegalArgumentException.class,
                () -> UcpHttpTransport.open(URI.create("ftp://merchant.example"), TransportConfiguration.defaults()));
        assertThrows(IllegalArgumentException.class,
                () -> UcpHttpTransport.open(URI.create("merchant.example"), TransportConfiguration.defaults()));
    }

    @Test
    void trailingSlashIsIgnored() throws Exception {
        try (var merchant = FakeMerchantServer.start();
                var transport = UcpHttpTransport.open(
                        URI.create(merchant.baseUrl() + "/"), TransportConfiguration.defaults())) {
            merchant.respond("GET", "/\\.well-known/ucp", 200, "{}");

            assertTrue(transport.send(HttpMethod.GET, "/.well-known/ucp", null).isSuccess());
            assertEquals("/.well-known/ucp", merchant.requests().get(0).path());
        }
    }
}
