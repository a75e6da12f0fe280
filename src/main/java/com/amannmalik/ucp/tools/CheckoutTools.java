package com.amannmalik.ucp.tools;

import com.amannmalik.ucp.api.checkout.CheckoutSessionOrchestrator;
import com.amannmalik.ucp.api.checkout.model.Buyer;
import com.amannmalik.ucp.api.checkout.model.CardDetails;
import com.amannmalik.ucp.api.checkout.model.CheckoutSessionId;
import com.amannmalik.ucp.api.checkout.model.Item;
import com.amannmalik.ucp.api.shared.CurrencyCode;
import com.amannmalik.ucp.api.shared.Result;
import com.amannmalik.ucp.client.TransportConfiguration;
import com.amannmalik.ucp.client.UcpClient;
import com.amannmalik.ucp.util.Ensure;
import jakarta.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.function.Function;

/**
 * Agent-facing checkout operations. Each call opens a client for the merchant, runs one
 * operation and closes the client again. Results are JSON objects; failures are reported as
 * {@code {"error": "..."}} and never thrown.
 */
public final class CheckoutTools {
    public static final String DEFAULT_CURRENCY = "USD";
    public static final String DEFAULT_PAYMENT_HANDLER_ID = "mock_payment_handler";
    public static final String DEFAULT_CARD_TOKEN = "success_token";
    public static final String DEFAULT_CARD_BRAND = "Visa";
    public static final String DEFAULT_CARD_LAST_DIGITS = "4242";

    private static final Logger log = LoggerFactory.getLogger(CheckoutTools.class);

    private final ClientFactory clients;

    public CheckoutTools(TransportConfiguration configuration) {
        this(merchant -> UcpClient.open(merchant, Ensure.notNull("tools.configuration", configuration)));
    }

    public CheckoutTools(ClientFactory clients) {
        this.clients = Ensure.notNull("tools.clients", clients);
    }

    private static URI merchantUri(String merchantUrl) {
        var trimmed = Ensure.nonBlank("merchant_url", merchantUrl).trim();
        try {
            return URI.create(trimmed);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid merchant URL: " + trimmed, e);
        }
    }

    private static CheckoutSessionId checkoutId(String checkoutId) {
        return new CheckoutSessionId(Ensure.nonBlank("checkout_id", checkoutId).trim());
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null || e.getMessage().isBlank() ? e.getClass().getSimpleName() : e.getMessage();
    }

    public JsonObject discover(String merchantUrl) {
        return withClient("discover", merchantUrl, client -> client.discover().map(ToolResponses::discovery));
    }

    public JsonObject createCheckout(
            String merchantUrl, List<Item> items, String buyerName, String buyerEmail, String currency) {
        return withClient("create_checkout", merchantUrl, client -> {
            var buyer = new Buyer(buyerName, buyerEmail);
            var code = new CurrencyCode(currency == null || currency.isBlank() ? DEFAULT_CURRENCY : currency);
            return new CheckoutSessionOrchestrator(client).create(items, buyer, code).map(ToolResponses::created);
        });
    }

    public JsonObject updateCheckout(String merchantUrl, String checkoutId, List<String> discountCodes) {
        return withClient("update_checkout", merchantUrl, client -> new CheckoutSessionOrchestrator(client)
                .update(checkoutId(checkoutId), discountCodes, null)
                .map(ToolResponses::updated));
    }

    /// Selects the first offered shipping destination and option. Run before completing when the merchant ships.
    public JsonObject setFulfillment(String merchantUrl, String checkoutId) {
        return withClient("set_fulfillment", merchantUrl, client -> new CheckoutSessionOrchestrator(client)
                .negotiate(checkoutId(checkoutId))
                .map(ToolResponses::fulfillment));
    }

    public JsonObject completeCheckout(String merchantUrl, String checkoutId, String handlerId, CardDetails card) {
        return withClient("complete_checkout", merchantUrl, client -> {
            var handler = handlerId == null || handlerId.isBlank() ? DEFAULT_PAYMENT_HANDLER_ID : handlerId;
            var details = card == null
                    ? new CardDetails(DEFAULT_CARD_BRAND, DEFAULT_CARD_LAST_DIGITS, DEFAULT_CARD_TOKEN)
                    : card;
            return new CheckoutSessionOrchestrator(client)
                    .complete(checkoutId(checkoutId), handler, details)
                    .map(ToolResponses::completed);
        });
    }

    private JsonObject withClient(String operation, String merchantUrl, Function<UcpClient, Result<JsonObject>> action) {
        try (var client = clients.open(merchantUri(merchantUrl))) {
            var result = action.apply(client);
            if (result.isFailure()) {
                var error = result.error().orElseThrow();
                log.warn("{} against {} failed: {}", operation, client.merchant(), error.describe());
                return ToolResponses.error(error.describe());
            }
            return result.orElseThrow();
        } catch (IllegalArgumentException e) {
            log.warn("{} rejected: {}", operation, e.getMessage());
            return ToolResponses.error("Invalid request: " + e.getMessage());
        } catch (RuntimeException | LinkageError e) {
            // LinkageError covers broken class initialization; other Errors propagate.
            log.error("{} failed unexpectedly", operation, e);
            return ToolResponses.error("Error during " + operation + ": " + describe(e));
        }
    }

    /// Opens a client scoped to one tool call.
    @FunctionalInterface
    public interface ClientFactory {
        UcpClient open(URI merchant);
    }
}
