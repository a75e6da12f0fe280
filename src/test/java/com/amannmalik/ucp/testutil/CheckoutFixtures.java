package com.amannmalik.ucp.testutil;

import com.amannmalik.ucp.api.checkout.model.CheckoutSession;
import com.amannmalik.ucp.codec.CheckoutSessionJsonCodec;
import jakarta.json.Json;
import jakarta.json.JsonObject;

import java.io.StringReader;

/// Merchant payloads shaped like the sample flower shop server.
public final class CheckoutFixtures {
    public static final String SESSION_ID = "checkout-123";
    public static final String ORDER_ID = "order-abc-123";
    public static final String ORDER_URL = "http://localhost:8182/orders/order-abc-123";

    public static final String DISCOVERY = """
            {
              "ucp": {
                "version": "2026-01-11",
                "capabilities": [
                  {"name": "dev.ucp.shopping.checkout", "version": "2026-01-11",
                   "spec": "https://ucp.dev/specs/shopping/checkout"},
                  {"name": "dev.ucp.shopping.discount", "version": "2026-01-11",
                   "extends": "dev.ucp.shopping.checkout"},
                  {"name": "dev.ucp.shopping.fulfillment", "version": "2026-01-11"}
                ]
              },
              "payment": {
                "handlers": [
                  {"id": "mock_payment_handler", "name": "dev.ucp.mock_payment", "version": "2026-01-11",
                   "config": {"supported_tokens": ["success_token"]}}
                ]
              }
            }
            """;

    public static final String SESSION_READY = """
            {
              "id": "checkout-123",
              "status": "ready_for_complete",
              "currency": "USD",
              "line_items": [
                {"id": "li_1", "item": {"id": "bouquet_roses", "title": "Red Rose Bouquet", "price": 3500},
                 "quantity": 1,
                 "totals": [{"type": "subtotal", "amount": 3500}]}
              ],
              "totals": [
                {"type": "subtotal", "amount": 3500},
                {"type": "total", "amount": 3500}
              ],
              "payment": {
                "instruments": [],
                "handlers": [{"id": "mock_payment_handler", "name": "dev.ucp.mock_payment", "version": "2026-01-11"}]
              },
              "buyer": {"full_name": "John Doe", "email": "john@example.com"}
            }
            """;

    public static final String SESSION_DISCOUNTED = """
            {
              "id": "checkout-123",
              "status": "ready_for_complete",
              "currency": "USD",
              "line_items": [
                {"id": "li_1", "item": {"id": "bouquet_roses", "title": "Red Rose Bouquet", "price": 3500},
                 "quantity": 1}
              ],
              "discounts": {
                "codes": ["10OFF"],
                "applied": [{"code": "10OFF", "title": "10% off", "amount": 350}]
              },
              "totals": [
                {"type": "subtotal", "amount": 3500},
                {"type": "discount", "amount": 350},
                {"type": "total", "amount": 3150}
              ],
              "payment": {
                "instruments": [],
                "handlers": [{"id": "mock_payment_handler", "name": "dev.ucp.mock_payment", "version": "2026-01-11"}]
              }
            }
            """;

    public static final String SESSION_COMPLETED = """
            {
              "id": "checkout-123",
              "status": "complete",
              "currency": "USD",
              "line_items": [
                {"id": "li_1", "item": {"id": "bouquet_roses", "title": "Red Rose Bouquet"}, "quantity": 1}
              ],
              "totals": [{"type": "total", "amount": 3500}],
              "order": {"id": "order-abc-123", "permalink_url": "http://localhost:8182/orders/order-abc-123"}
            }
            """;

    public static final String FULFILLMENT_DESTINATIONS_OFFERED = """
            {
              "id": "checkout-123",
              "status": "incomplete",
              "currency": "USD",
              "line_items": [
                {"id": "li_1", "item": {"id": "bouquet_roses", "title": "Red Rose Bouquet"}, "quantity": 1}
              ],
              "totals": [{"type": "subtotal", "amount": 3500}, {"type": "total", "amount": 3500}],
              "fulfillment": {
                "methods": [
                  {"id": "method_1", "type": "shipping", "line_item_ids": ["li_1"],
                   "destinations": [
                     {"id": "dest_home", "street_address": "123 Main St", "address_locality": "Springfield"},
                     {"id": "dest_work", "street_address": "9 Elm Ave", "address_locality": "Springfield"}
                   ]}
                ]
              }
            }
            """;

    public static final String FULFILLMENT_OPTIONS_OFFERED = """
            {
              "id": "checkout-123",
              "status": "incomplete",
              "currency": "USD",
              "line_items": [
                {"id": "li_1", "item": {"id": "bouquet_roses", "title": "Red Rose Bouquet"}, "quantity": 2}
              ],
              "totals": [{"type": "subtotal", "amount": 7000}, {"type": "total", "amount": 7000}],
              "fulfillment": {
                "methods": [
                  {"id": "method_1", "type": "shipping", "line_item_ids": ["li_1"],
                   "destinations": [{"id": "dest_home", "street_address": "123 Main St"}],
                   "selected_destination_id": "dest_home",
                   "groups": [
                     {"id": "group_1", "line_item_ids": ["li_1"],
                      "options": [
                        {"id": "std-ship", "title": "Standard", "totals": [{"type": "total", "amount": 500}]},
                        {"id": "exp-ship", "title": "Express", "totals": [{"type": "total", "amount": 1500}]}
                      ]}
                   ]}
                ]
              }
            }
            """;

    public static final String FULFILLMENT_NEGOTIATED = """
            {
              "id": "checkout-123",
              "status": "ready_for_complete",
              "currency": "USD",
              "line_items": [
                {"id": "li_1", "item": {"id": "bouquet_roses", "title": "Red Rose Bouquet"}, "quantity": 2}
              ],
              "totals": [
                {"type": "subtotal", "amount": 7000},
                {"type": "fulfillment", "amount": 500},
                {"type": "total", "amount": 7500}
              ],
              "fulfillment": {
                "methods": [
                  {"id": "method_1", "type": "shipping", "line_item_ids": ["li_1"],
                   "destinations": [{"id": "dest_home", "street_address": "123 Main St"}],
                   "selected_destination_id": "dest_home",
                   "groups": [
                     {"id": "group_1", "line_item_ids": ["li_1"],
                      "options": [{"id": "std-ship", "title": "Standard", "totals": [{"type": "total", "amount": 500}]}],
                      "selected_option_id": "std-ship"}
                   ]}
                ]
              }
            }
            """;

    public static final String FULFILLMENT_NO_DESTINATIONS = """
            {
              "id": "checkout-123",
              "status": "incomplete",
              "currency": "USD",
              "line_items": [
                {"id": "li_1", "item": {"id": "bouquet_roses", "title": "Red Rose Bouquet"}, "quantity": 1}
              ],
              "totals": [{"type": "total", "amount": 3500}],
              "fulfillment": {"methods": [{"type": "shipping", "destinations": []}]}
            }
            """;

    public static final String FULFILLMENT_NO_OPTIONS = """
            {
              "id": "checkout-123",
              "status": "incomplete",
              "currency": "USD",
              "line_items": [
                {"id": "li_1", "item": {"id": "bouquet_roses", "title": "Red Rose Bouquet"}, "quantity": 1}
              ],
              "totals": [{"type": "total", "amount": 3500}],
              "fulfillment": {
                "methods": [
                  {"type": "shipping",
                   "destinations": [{"id": "dest_home"}],
                   "selected_destination_id": "dest_home",
                   "groups": []}
                ]
              }
            }
            """;

    public static final String FULFILLMENT_LATER_METHOD_OFFERS_DESTINATION = """
            {
              "id": "checkout-123",
              "status": "incomplete",
              "currency": "USD",
              "line_items": [
                {"id": "li_1", "item": {"id": "bouquet_roses", "title": "Red Rose Bouquet"}, "quantity": 1}
              ],
              "totals": [{"type": "total", "amount": 3500}],
              "fulfillment": {
                "methods": [
                  {"id": "method_pickup", "type": "pickup", "destinations": []},
                  {"id": "method_ship", "type": "shipping", "destinations": [{"id": "dest_only"}]}
                ]
              }
            }
            """;

    public static final String FULFILLMENT_LATER_METHOD_OPTIONS = """
            {
              "id": "checkout-123",
              "status": "incomplete",
              "currency": "USD",
              "line_items": [
                {"id": "li_1", "item": {"id": "bouquet_roses", "title": "Red Rose Bouquet"}, "quantity": 1}
              ],
              "totals": [{"type": "total", "amount": 3500}],
              "fulfillment": {
                "methods": [
                  {"id": "method_pickup", "type": "pickup", "destinations": [],
                   "groups": [{"options": [{"id": "pickup-now", "title": "Pick up today"}]}]},
                  {"id": "method_ship", "type": "shipping",
                   "destinations": [{"id": "dest_only"}],
                   "selected_destination_id": "dest_only",
                   "groups": [{"options": [{"id": "ground", "title": "Ground"}]}]}
                ]
              }
            }
            """;

    public static final String FULFILLMENT_LATER_METHOD_NEGOTIATED = """
            {
              "id": "checkout-123",
              "status": "ready_for_complete",
              "currency": "USD",
              "line_items": [
                {"id": "li_1", "item": {"id": "bouquet_roses", "title": "Red Rose Bouquet"}, "quantity": 1}
              ],
              "totals": [{"type": "fulfillment", "amount": 700}, {"type": "total", "amount": 4200}],
              "fulfillment": {
                "methods": [
                  {"id": "method_ship", "type": "shipping",
                   "destinations": [{"id": "dest_only"}],
                   "selected_destination_id": "dest_only",
                   "groups": [{"options": [{"id": "ground", "title": "Ground"}], "selected_option_id": "ground"}]}
                ]
              }
            }
            """;

    private CheckoutFixtures() {
    }

    public static JsonObject json(String text) {
        try (var reader = Json.createReader(new StringReader(text))) {
            return reader.readObject();
        }
    }

    public static CheckoutSession session(String text) {
        return new CheckoutSessionJsonCodec().readCheckoutSession(json(text));
    }
}
