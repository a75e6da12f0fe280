package com.amannmalik.ucp.client;

import com.amannmalik.ucp.api.checkout.CheckoutSessionApi;
import com.amannmalik.ucp.api.checkout.model.*;
import com.amannmalik.ucp.api.discovery.model.DiscoveryDocument;
import com.amannmalik.ucp.api.shared.Result;
import com.amannmalik.ucp.api.shared.UcpError;
import com.amannmalik.ucp.codec.CheckoutSessionJsonCodec;
import com.amannmalik.ucp.codec.DiscoveryJsonCodec;
import com.amannmalik.ucp.codec.JsonDecodingException;
import com.amannmalik.ucp.util.Ensure;
import jakarta.json.JsonObject;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.function.Function;

/**
 * REST binding of one merchant's UCP endpoints. Open it for a logical operation and close it
 * on every exit path:
 *
 * <pre>{@code
 * try (var client = UcpClient.open(merchant, TransportConfiguration.defaults())) {
 *     client.discover();
 * }
 * }</pre>
 */
public final class UcpClient implements CheckoutSessionApi, AutoCloseable {
    static final String DISCOVERY_PATH = "/.well-known/ucp";
    static final String CHECKOUT_SESSIONS_PATH = "/checkout-sessions";

    private final UcpHttpTransport transport;
    private final CheckoutSessionJsonCodec checkoutCodec;
    private final DiscoveryJsonCodec discoveryCodec;

    public UcpClient(UcpHttpTransport transport) {
        this(transport, new CheckoutSessionJsonCodec(), new DiscoveryJsonCodec());
    }

    public UcpClient(
            UcpHttpTransport transport, CheckoutSessionJsonCodec checkoutCodec, DiscoveryJsonCodec discoveryCodec) {
        this.transport = Ensure.notNull("client.transport", transport);
        this.checkoutCodec = Ensure.notNull("client.checkout_codec", checkoutCodec);
        this.discoveryCodec = Ensure.notNull("client.discovery_codec", discoveryCodec);
    }

    public static UcpClient open(URI merchant, TransportConfiguration configuration) {
        return new UcpClient(UcpHttpTransport.open(merchant, configuration));
    }

    private static String sessionPath(CheckoutSessionId id) {
        var encoded = URLEncoder.encode(id.value(), StandardCharsets.UTF_8).replace("+", "%20");
        return CHECKOUT_SESSIONS_PATH + "/" + encoded;
    }

    private static <T> Result<T> decode(JsonObject json, Function<JsonObject, T> reader) {
        try {
            return Result.success(reader.apply(json));
        } catch (JsonDecodingException e) {
            return Result.failure(new UcpError.DecodeError(e.getMessage() == null ? "invalid payload" : e.getMessage(), e));
        }
    }

    public URI merchant() {
        return transport.merchant();
    }

    public Result<DiscoveryDocument> discover() {
        return transport.send(HttpMethod.GET, DISCOVERY_PATH, null)
                .flatMap(json -> decode(json, discoveryCodec::readDiscoveryDocument));
    }

    @Override
    public Result<CheckoutSession> create(CheckoutSessionCreateRequest request) {
        var body = checkoutCodec.writeCreateRequest(Ensure.notNull("create_request", request));
        return session(transport.send(HttpMethod.POST, CHECKOUT_SESSIONS_PATH, body));
    }

    @Override
    public Result<CheckoutSession> retrieve(CheckoutSessionId id) {
        return session(transport.send(HttpMethod.GET, sessionPath(Ensure.notNull("checkout_session.id", id)), null));
    }

    @Override
    public Result<CheckoutSession> update(CheckoutSessionUpdateRequest request) {
        var body = checkoutCodec.writeUpdateRequest(Ensure.notNull("update_request", request));
        return session(transport.send(HttpMethod.PUT, sessionPath(request.id()), body));
    }

    @Override
    public Result<CheckoutSession> complete(CheckoutSessionId id, CheckoutSessionCompleteRequest request) {
        var body = checkoutCodec.writeCompleteRequest(Ensure.notNull("complete_request", request));
        return session(transport.send(
                HttpMethod.POST, sessionPath(Ensure.notNull("checkout_session.id", id)) + "/complete", body));
    }

    private Result<CheckoutSession> session(Result<JsonObject> response) {
        return response.flatMap(json -> decode(json, checkoutCodec::readCheckoutSession));
    }

    @Override
    public void close() {
        transport.close();
    }
}
