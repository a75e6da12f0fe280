package com.amannmalik.ucp.api.checkout.tests;

import com.amannmalik.ucp.api.checkout.CheckoutChange;
import com.amannmalik.ucp.api.checkout.CheckoutSessionUpdateMerger;
import com.amannmalik.ucp.api.checkout.model.*;
import com.amannmalik.ucp.api.shared.CurrencyCode;
import com.amannmalik.ucp.api.shared.Result;
import com.amannmalik.ucp.api.shared.UcpError;
import com.amannmalik.ucp.testutil.CheckoutFixtures;
import com.amannmalik.ucp.testutil.ScriptedCheckoutSessionApi;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CheckoutSessionUpdateMergerTest {
    private static final CheckoutSessionId ID = new CheckoutSessionId(CheckoutFixtures.SESSION_ID);

    @Test
    void discountChangeCarriesEverythingElseForward() {
        var current = CheckoutFixtures.session(CheckoutFixtures.SESSION_READY);
        var api = new ScriptedCheckoutSessionApi()
                .onRetrieve(Result.success(current))
                .onUpdate(Result.success(CheckoutFixtures.session(CheckoutFixtures.SESSION_DISCOUNTED)));

        var updated = new CheckoutSessionUpdateMerger(api).apply(ID, CheckoutChange.discountCodes(List.of("10OFF")));

        assertEquals(3150, updated.orElseThrow().total());
        var sent = api.updateRequests().get(0);
        assertEquals(List.of("10OFF"), sent.discountCodes());
        assertEquals(current.currency(), sent.currency());
        assertEquals(current.payment(), sent.payment());
        assertEquals(1, sent.lineItems().size());
        var lineItem = sent.lineItems().get(0);
        assertEquals("li_1", lineItem.id());
        assertEquals(current.lineItems().get(0).item(), lineItem.item());
        assertEquals(1, lineItem.quantity());
        assertNull(sent.fulfillment());
    }

    @Test
    void failedReadFallsBackToEmptySnapshot() {
        var api = new ScriptedCheckoutSessionApi()
                .onRetrieve(Result.failure(new UcpError.ProtocolHttpError(500, "boom")))
                .onUpdate(Result.success(CheckoutFixtures.session(CheckoutFixtures.SESSION_DISCOUNTED)));

        var updated = new CheckoutSessionUpdateMerger(api).apply(ID, CheckoutChange.discountCodes(List.of("10OFF")));

        assertTrue(updated.isSuccess());
        var sent = api.updateRequests().get(0);
        assertEquals(CurrencyCode.USD, sent.currency());
        assertEquals(Payment.empty(), sent.payment());
        assertNull(sent.lineItems());
        assertEquals(List.of("10OFF"), sent.discountCodes());
    }

    @Test
    void callerLineItemsReplaceStoredOnes() {
        var replacement = List.of(LineItemRequest.of(new Item("bouquet_tulips", "Tulips", 3)));

        var request = CheckoutSessionUpdateMerger.merge(
                ID, CheckoutFixtures.session(CheckoutFixtures.SESSION_READY), CheckoutChange.lineItems(replacement));

        assertEquals(replacement, request.lineItems());
        assertNull(request.discountCodes());
    }

    @Test
    void emptyCallerLineItemsMeanNoChange() {
        var snapshot = CheckoutFixtures.session(CheckoutFixtures.SESSION_READY);

        var request = CheckoutSessionUpdateMerger.merge(ID, snapshot, new CheckoutChange(null, List.of(), null));

        assertEquals(1, request.lineItems().size());
        assertEquals("li_1", request.lineItems().get(0).id());
    }

    @Test
    void updateFailureIsReturnedUnchanged() {
        var api = new ScriptedCheckoutSessionApi()
                .onRetrieve(Result.success(CheckoutFixtures.session(CheckoutFixtures.SESSION_READY)))
                .onUpdate(Result.failure(new UcpError.ProtocolHttpError(400, "{\"detail\":\"invalid code\"}")));

        var updated = new CheckoutSessionUpdateMerger(api).apply(ID, CheckoutChange.discountCodes(List.of("BOGUS")));

        var error = assertInstanceOf(UcpError.ProtocolHttpError.class, updated.error().orElseThrow());
        assertEquals(400, error.status());
        assertTrue(error.body().contains("invalid code"));
    }
}
