package com.amannmalik.ucp.codec;

import com.amannmalik.ucp.api.checkout.model.*;
import com.amannmalik.ucp.api.shared.CurrencyCode;
import jakarta.json.*;

import java.util.List;

/// Wire mapping for the UCP checkout REST binding (`/checkout-sessions`).
public final class CheckoutSessionJsonCodec {
    public CheckoutSessionJsonCodec() {
    }

    private static Total mapTotal(JsonObject object) {
        return new Total(
                JsonSupport.requireString(object, "type"),
                JsonSupport.optionalAmount(object, "amount"),
                JsonSupport.optionalString(object, "display_text"));
    }

    private static LineItem mapLineItem(JsonObject object) {
        var item = JsonSupport.optionalObject(object, "item");
        if (item == null) {
            throw new JsonDecodingException("Missing object: item");
        }
        return new LineItem(
                JsonSupport.optionalString(object, "id"),
                item,
                JsonSupport.requireInt(object, "quantity"),
                JsonSupport.mapObjects(object, "totals", CheckoutSessionJsonCodec::mapTotal));
    }

    private static AppliedDiscount mapAppliedDiscount(JsonObject object) {
        return new AppliedDiscount(
                JsonSupport.requireString(object, "code"),
                JsonSupport.optionalString(object, "title"),
                JsonSupport.optionalAmount(object, "amount"),
                JsonSupport.optionalBoolean(object, "automatic", false));
    }

    private static Discounts mapDiscounts(JsonObject root) {
        var object = JsonSupport.optionalObject(root, "discounts");
        if (object == null) {
            return Discounts.none();
        }
        return new Discounts(
                JsonSupport.strings(object, "codes"),
                JsonSupport.mapObjects(object, "applied", CheckoutSessionJsonCodec::mapAppliedDiscount));
    }

    private static FulfillmentOption mapFulfillmentOption(JsonObject object) {
        return new FulfillmentOption(
                JsonSupport.requireString(object, "id"),
                JsonSupport.optionalString(object, "title"),
                JsonSupport.mapObjects(object, "totals", CheckoutSessionJsonCodec::mapTotal));
    }

    private static FulfillmentGroup mapFulfillmentGroup(JsonObject object) {
        return new FulfillmentGroup(
                JsonSupport.optionalString(object, "id"),
                JsonSupport.strings(object, "line_item_ids"),
                JsonSupport.mapObjects(object, "options", CheckoutSessionJsonCodec::mapFulfillmentOption),
                JsonSupport.optionalString(object, "selected_option_id"));
    }

    private static FulfillmentDestination mapFulfillmentDestination(JsonObject object) {
        return new FulfillmentDestination(JsonSupport.requireString(object, "id"), object);
    }

    private static FulfillmentMethod mapFulfillmentMethod(JsonObject object) {
        var type = JsonSupport.optionalString(object, "type");
        return new FulfillmentMethod(
                JsonSupport.optionalString(object, "id"),
                type == null ? FulfillmentMethod.SHIPPING : type,
                JsonSupport.strings(object, "line_item_ids"),
                JsonSupport.mapObjects(object, "destinations", CheckoutSessionJsonCodec::mapFulfillmentDestination),
                JsonSupport.optionalString(object, "selected_destination_id"),
                JsonSupport.mapObjects(object, "groups", CheckoutSessionJsonCodec::mapFulfillmentGroup));
    }

    private static Fulfillment mapFulfillment(JsonObject root) {
        var object = JsonSupport.optionalObject(root, "fulfillment");
        if (object == null) {
            return null;
        }
        return new Fulfillment(
                JsonSupport.mapObjects(object, "methods", CheckoutSessionJsonCodec::mapFulfillmentMethod));
    }

    private static Payment mapPayment(JsonObject root) {
        var object = JsonSupport.optionalObject(root, "payment");
        if (object == null) {
            return null;
        }
        return new Payment(JsonSupport.objects(object, "instruments"), JsonSupport.objects(object, "handlers"));
    }

    private static Buyer mapBuyer(JsonObject root) {
        var object = JsonSupport.optionalObject(root, "buyer");
        if (object == null) {
            return null;
        }
        var fullName = JsonSupport.optionalString(object, "full_name");
        var email = JsonSupport.optionalString(object, "email");
        if (fullName == null || email == null) {
            return null;
        }
        return new Buyer(fullName, email);
    }

    private static Order mapOrder(JsonObject root) {
        var object = JsonSupport.optionalObject(root, "order");
        if (object == null) {
            return null;
        }
        var id = JsonSupport.optionalString(object, "id");
        if (id == null) {
            return null;
        }
        return new Order(id, JsonSupport.optionalUri(object, "permalink_url"));
    }

    private static CurrencyCode mapCurrency(JsonObject root) {
        var currency = JsonSupport.optionalString(root, "currency");
        return currency == null ? null : new CurrencyCode(currency);
    }

    private static JsonObjectBuilder writeLineItem(LineItemRequest lineItem) {
        var builder = Json.createObjectBuilder();
        if (lineItem.id() != null) {
            builder.add("id", lineItem.id());
        }
        return builder
                .add("item", lineItem.item())
                .add("quantity", lineItem.quantity());
    }

    private static JsonArrayBuilder writeLineItems(List<LineItemRequest> lineItems) {
        var builder = Json.createArrayBuilder();
        for (var lineItem : lineItems) {
            builder.add(writeLineItem(lineItem));
        }
        return builder;
    }

    private static JsonObjectBuilder writePayment(Payment payment) {
        return Json.createObjectBuilder()
                .add("instruments", JsonSupport.writeObjects(payment.instruments()))
                .add("handlers", JsonSupport.writeObjects(payment.handlers()));
    }

    private static JsonObjectBuilder writeFulfillmentRequest(FulfillmentRequest fulfillment) {
        var method = Json.createObjectBuilder().add("type", fulfillment.type());
        if (fulfillment.selectedDestinationId() != null) {
            method.add("selected_destination_id", fulfillment.selectedDestinationId());
        }
        if (fulfillment.selectedOptionId() != null) {
            method.add("groups", Json.createArrayBuilder()
                    .add(Json.createObjectBuilder().add("selected_option_id", fulfillment.selectedOptionId())));
        }
        return Json.createObjectBuilder().add("methods", Json.createArrayBuilder().add(method));
    }

    private static JsonArrayBuilder writeTotals(List<Total> totals) {
        var builder = Json.createArrayBuilder();
        for (var total : totals) {
            var json = Json.createObjectBuilder()
                    .add("type", total.type())
                    .add("amount", total.amount().value());
            if (total.displayText() != null) {
                json.add("display_text", total.displayText());
            }
            builder.add(json);
        }
        return builder;
    }

    private static JsonObjectBuilder writeFulfillmentGroup(FulfillmentGroup group) {
        var json = Json.createObjectBuilder();
        if (group.id() != null) {
            json.add("id", group.id());
        }
        json.add("line_item_ids", JsonSupport.writeStrings(group.lineItemIds()));
        var options = Json.createArrayBuilder();
        for (var option : group.options()) {
            var optionJson = Json.createObjectBuilder().add("id", option.id());
            if (option.title() != null) {
                optionJson.add("title", option.title());
            }
            options.add(optionJson.add("totals", writeTotals(option.totals())));
        }
        json.add("options", options);
        if (group.selectedOptionId() != null) {
            json.add("selected_option_id", group.selectedOptionId());
        }
        return json;
    }

    public CheckoutSession readCheckoutSession(JsonObject root) {
        try {
            return new CheckoutSession(
                    new CheckoutSessionId(JsonSupport.requireString(root, "id")),
                    CheckoutSessionStatus.fromJsonValue(JsonSupport.requireString(root, "status")),
                    mapCurrency(root),
                    JsonSupport.mapObjects(root, "line_items", CheckoutSessionJsonCodec::mapLineItem),
                    JsonSupport.mapObjects(root, "totals", CheckoutSessionJsonCodec::mapTotal),
                    mapDiscounts(root),
                    mapFulfillment(root),
                    mapPayment(root),
                    mapBuyer(root),
                    mapOrder(root));
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new JsonDecodingException(e.getMessage(), e);
        }
    }

    public JsonObject writeCreateRequest(CheckoutSessionCreateRequest request) {
        return Json.createObjectBuilder()
                .add("line_items", writeLineItems(request.lineItems()))
                .add("buyer", Json.createObjectBuilder()
                        .add("full_name", request.buyer().fullName())
                        .add("email", request.buyer().email()))
                .add("currency", request.currency().value())
                .add("payment", writePayment(request.payment()))
                .build();
    }

    public JsonObject writeUpdateRequest(CheckoutSessionUpdateRequest request) {
        var builder = Json.createObjectBuilder().add("id", request.id().value());
        if (request.lineItems() != null) {
            builder.add("line_items", writeLineItems(request.lineItems()));
        }
        builder.add("currency", request.currency().value());
        builder.add("payment", writePayment(request.payment()));
        if (request.discountCodes() != null) {
            builder.add("discounts", Json.createObjectBuilder()
                    .add("codes", JsonSupport.writeStrings(request.discountCodes())));
        }
        if (request.fulfillment() != null) {
            builder.add("fulfillment", writeFulfillmentRequest(request.fulfillment()));
        }
        return builder.build();
    }

    public JsonObject writeCompleteRequest(CheckoutSessionCompleteRequest request) {
        var paymentData = request.paymentData();
        var card = paymentData.card();
        return Json.createObjectBuilder()
                .add("payment_data", Json.createObjectBuilder()
                        .add("id", paymentData.id())
                        .add("handler_id", paymentData.handlerId())
                        .add("handler_name", paymentData.handlerName())
                        .add("type", PaymentData.TYPE_CARD)
                        .add("brand", card.brand())
                        .add("last_digits", card.lastDigits())
                        .add("credential", Json.createObjectBuilder()
                                .add("type", PaymentData.CREDENTIAL_TYPE_TOKEN)
                                .add("token", card.token()))
                        .add("billing_address", AddressJson.write(paymentData.billingAddress())))
                .add("risk_signals", Json.createObjectBuilder()
                        .add("ip", request.riskSignals().ipAddress())
                        .add("browser", request.riskSignals().browser()))
                .build();
    }

    public JsonObject writeDiscounts(Discounts discounts) {
        var applied = Json.createArrayBuilder();
        for (var discount : discounts.applied()) {
            var json = Json.createObjectBuilder().add("code", discount.code());
            if (discount.title() != null) {
                json.add("title", discount.title());
            }
            applied.add(json
                    .add("amount", discount.amount().value())
                    .add("automatic", discount.automatic()));
        }
        return Json.createObjectBuilder()
                .add("codes", JsonSupport.writeStrings(discounts.codes()))
                .add("applied", applied)
                .build();
    }

    public JsonObject writeFulfillment(Fulfillment fulfillment) {
        var methods = Json.createArrayBuilder();
        for (var method : fulfillment.methods()) {
            var json = Json.createObjectBuilder();
            if (method.id() != null) {
                json.add("id", method.id());
            }
            json.add("type", method.type());
            json.add("line_item_ids", JsonSupport.writeStrings(method.lineItemIds()));
            var destinations = Json.createArrayBuilder();
            method.destinations().forEach(destination -> destinations.add(destination.address()));
            json.add("destinations", destinations);
            if (method.selectedDestinationId() != null) {
                json.add("selected_destination_id", method.selectedDestinationId());
            }
            var groups = Json.createArrayBuilder();
            method.groups().forEach(group -> groups.add(writeFulfillmentGroup(group)));
            json.add("groups", groups);
            methods.add(json);
        }
        return Json.createObjectBuilder().add("methods", methods).build();
    }
}
