package com.amannmalik.ucp.api.checkout;

import com.amannmalik.ucp.api.checkout.model.*;
import com.amannmalik.ucp.api.shared.Result;

/**
 * Merchant-side checkout session resource. The merchant is the source of truth; every call
 * returns a fresh snapshot.
 */
public interface CheckoutSessionApi {
    Result<CheckoutSession> create(CheckoutSessionCreateRequest request);

    Result<CheckoutSession> retrieve(CheckoutSessionId id);

    Result<CheckoutSession> update(CheckoutSessionUpdateRequest request);

    Result<CheckoutSession> complete(CheckoutSessionId id, CheckoutSessionCompleteRequest request);
}
