package com.amannmalik.ucp.client;

import com.amannmalik.ucp.api.shared.Result;
import com.amannmalik.ucp.api.shared.UcpError;
import com.amannmalik.ucp.util.Ensure;
import jakarta.json.Json;
import jakarta.json.JsonException;
import jakarta.json.JsonObject;
import jakarta.json.JsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Sends one JSON request per call to a single merchant and maps every outcome onto a
 * {@link Result}. Nothing is retried; a physical retry by the caller gets a fresh
 * idempotency key.
 */
public final class UcpHttpTransport implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UcpHttpTransport.class);
    private static final String APPLICATION_JSON = "application/json";

    private final HttpClient httpClient;
    private final ExecutorService executor;
    private final String merchantBase;
    private final TransportConfiguration configuration;
    private final Supplier<String> requestIdSupplier;
    private final Supplier<String> idempotencyKeySupplier;
    private final AtomicBoolean closed = new AtomicBoolean();

    public UcpHttpTransport(HttpClient httpClient, URI merchant, TransportConfiguration configuration) {
        this(httpClient, null, merchant, configuration,
                UcpHttpTransport::defaultRequestId, UcpHttpTransport::defaultIdempotencyKey);
    }

    public UcpHttpTransport(
            HttpClient httpClient,
            URI merchant,
            TransportConfiguration configuration,
            Supplier<String> requestIdSupplier,
            Supplier<String> idempotencyKeySupplier) {
        this(httpClient, null, merchant, configuration, requestIdSupplier, idempotencyKeySupplier);
    }

    private UcpHttpTransport(
            HttpClient httpClient,
            ExecutorService executor,
            URI merchant,
            TransportConfiguration configuration,
            Supplier<String> requestIdSupplier,
            Supplier<String> idempotencyKeySupplier) {
        this.httpClient = Ensure.notNull("transport.http_client", httpClient);
        this.executor = executor;
        this.merchantBase = normalizeMerchant(merchant);
        this.configuration = Ensure.notNull("transport.configuration", configuration);
        this.requestIdSupplier =
                Objects.requireNonNullElse(requestIdSupplier, UcpHttpTransport::defaultRequestId);
        this.idempotencyKeySupplier =
                Objects.requireNonNullElse(idempotencyKeySupplier, UcpHttpTransport::defaultIdempotencyKey);
    }

    /// Opens a transport that owns its {@link HttpClient} and worker threads until {@link #close()}.
    public static UcpHttpTransport open(URI merchant, TransportConfiguration configuration) {
        Ensure.notNull("transport.configuration", configuration);
        var executor = Executors.newCachedThreadPool(runnable -> {
            var thread = new Thread(runnable, "ucp-http");
            thread.setDaemon(true);
            return thread;
        });
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(configuration.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .executor(executor)
                .build();
        try {
            return new UcpHttpTransport(
                    httpClient,
                    executor,
                    merchant,
                    configuration,
                    UcpHttpTransport::defaultRequestId,
                    UcpHttpTransport::defaultIdempotencyKey);
        } catch (RuntimeException e) {
            executor.shutdownNow();
            throw e;
        }
    }

    private static String normalizeMerchant(URI merchant) {
        Ensure.notNull("transport.merchant", merchant);
        var scheme = merchant.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new IllegalArgumentException("Merchant URL MUST use http or https: " + merchant);
        }
        if (merchant.getHost() == null) {
            throw new IllegalArgumentException("Merchant URL MUST include a host: " + merchant);
        }
        var base = merchant.toString();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

    private static String defaultRequestId() {
        return "req_" + UUID.randomUUID();
    }

    private static String defaultIdempotencyKey() {
        return "idem_" + UUID.randomUUID();
    }

    private static String describe(Exception e) {
        var message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    public URI merchant() {
        return URI.create(merchantBase);
    }

    public boolean isOpen() {
        return !closed.get();
    }

    public Result<JsonObject> send(HttpMethod method, String path, JsonObject body) {
        Ensure.notNull("request.method", method);
        Ensure.nonBlank("request.path", path);
        if (closed.get()) {
            return Result.failure(new UcpError.ClientMisuseError("transport for " + merchantBase + " is closed"));
        }
        var uri = URI.create(merchantBase + (path.startsWith("/") ? path : "/" + path));
        var payload = body == null ? "" : body.toString();
        var builder = HttpRequest.newBuilder(uri)
                .timeout(configuration.requestTimeout())
                .header("Content-Type", APPLICATION_JSON)
                .header("Accept", APPLICATION_JSON)
                .header("UCP-Agent", configuration.agentHeader())
                .header("request-signature", configuration.signer().sign(method, uri.getRawPath(), payload))
                .header("request-id", requestIdSupplier.get());
        if (method.mutating()) {
            builder.header("idempotency-key", idempotencyKeySupplier.get());
        }
        var publisher = method == HttpMethod.GET
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(payload);
        var request = builder.method(method.name(), publisher).build();
        log.debug("{} {}", method, uri);

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            return Result.failure(new UcpError.NetworkError(
                    "request timed out after " + configuration.requestTimeout(), e));
        } catch (IOException e) {
            return Result.failure(new UcpError.NetworkError(describe(e), e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.failure(new UcpError.NetworkError("request interrupted", e));
        }

        var status = response.statusCode();
        var responseBody = response.body() == null ? "" : response.body();
        log.debug("{} {} -> HTTP {}", method, uri, status);
        if (status < 200 || status >= 300) {
            return Result.failure(new UcpError.ProtocolHttpError(status, responseBody));
        }
        return parse(responseBody);
    }

    private Result<JsonObject> parse(String responseBody) {
        if (responseBody.isBlank()) {
            return Result.failure(new UcpError.DecodeError("empty response body", null));
        }
        try (var reader = Json.createReader(new StringReader(responseBody))) {
            var value = reader.readValue();
            if (value.getValueType() != JsonValue.ValueType.OBJECT) {
                return Result.failure(new UcpError.DecodeError(
                        "expected JSON object but got " + value.getValueType(), null));
            }
            return Result.success(value.asJsonObject());
        } catch (JsonException e) {
            return Result.failure(new UcpError.DecodeError(describe(e), e));
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (executor != null) {
            executor.shutdownNow();
        }
        log.debug("Closed transport for {}", merchantBase);
    }
}
