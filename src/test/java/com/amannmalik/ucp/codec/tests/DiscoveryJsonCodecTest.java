package com.amannmalik.ucp.codec.tests;

import com.amannmalik.ucp.api.discovery.model.DiscoveryDocument;
import com.amannmalik.ucp.codec.DiscoveryJsonCodec;
import com.amannmalik.ucp.codec.JsonDecodingException;
import com.amannmalik.ucp.testutil.CheckoutFixtures;
import jakarta.json.Json;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class DiscoveryJsonCodecTest {
    private final DiscoveryJsonCodec codec = new DiscoveryJsonCodec();

    @Test
    void readsMerchantProfile() {
        var document = codec.readDiscoveryDocument(CheckoutFixtures.json(CheckoutFixtures.DISCOVERY));

        assertEquals("2026-01-11", document.version());
        assertEquals(3, document.capabilities().size());
        assertTrue(document.supports("dev.ucp.shopping.discount"));
        assertEquals("dev.ucp.shopping.checkout", document.capabilities().get(1).extendsCapability());
        var handler = document.handler("mock_payment_handler").orElseThrow();
        assertEquals("dev.ucp.mock_payment", handler.name());
        assertEquals("success_token", handler.config().getJsonArray("supported_tokens").getString(0));
    }

    @Test
    void missingSectionsReadAsEmpty() {
        var document = codec.readDiscoveryDocument(Json.createObjectBuilder().build());

        assertEquals(DiscoveryDocument.UNKNOWN_VERSION, document.version());
        assertTrue(document.capabilities().isEmpty());
        assertTrue(document.paymentHandlers().isEmpty());
    }

    @Test
    void rejectsCapabilityWithoutName() {
        var json = Json.createObjectBuilder()
                .add("ucp", Json.createObjectBuilder()
                        .add("capabilities", Json.createArrayBuilder()
                                .add(Json.createObjectBuilder().add("version", "2026-01-11"))))
                .build();

        assertThrows(JsonDecodingException.class, () -> codec.readDiscoveryDocument(json));
    }
}
